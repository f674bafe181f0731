package com.scholary.audionotes.api;

import com.scholary.audionotes.logging.StructuredLogger;
import com.scholary.audionotes.recording.RecordingSession;
import com.scholary.audionotes.reference.AudioRecording;
import com.scholary.audionotes.reference.AudioReference;
import com.scholary.audionotes.reference.AudioReferenceStore;
import com.scholary.audionotes.service.NoteDocumentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the recording session.
 *
 * <p>Starting a recording opens the note, so blocks written into it while the recording runs are
 * tagged with their offsets.
 */
@RestController
@Tag(name = "Recordings", description = "Start and stop recordings and inspect their references")
public class RecordingController {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordingController.class);

  private final RecordingSession session;
  private final AudioReferenceStore store;
  private final NoteDocumentService documents;

  public RecordingController(
      RecordingSession session, AudioReferenceStore store, NoteDocumentService documents) {
    this.session = session;
    this.store = store;
    this.documents = documents;
  }

  @PostMapping("/recordings/start")
  @Operation(
      summary = "Start recording into a note",
      description = "Fails with 409 while another recording is active.")
  public ResponseEntity<AudioRecording> start(@Valid @RequestBody StartRecordingRequest request) {
    documents.open(request.noteId());
    AudioRecording recording = session.start(request.noteId());
    try {
      StructuredLogger.setRecordingContext(recording.id(), recording.noteId());
      LOGGER.info("Recording start request served: recordingId={}", recording.id());
    } finally {
      StructuredLogger.clearRecordingContext();
    }
    return ResponseEntity.status(HttpStatus.CREATED).body(recording);
  }

  @PostMapping("/recordings/stop")
  @Operation(
      summary = "Stop the active recording",
      description = "Returns the completed recording, or 204 when nothing was recording.")
  public ResponseEntity<AudioRecording> stop() {
    Optional<AudioRecording> stopped = session.stop();
    return stopped.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build());
  }

  @GetMapping("/recordings/current")
  @Operation(summary = "Current session status and offset")
  public RecordingSession.SessionSnapshot current() {
    return session.snapshot();
  }

  @PutMapping("/recordings/current/paused")
  @Operation(
      summary = "Mark the active recording paused or resumed",
      description = "Display only: capture and offsets keep running. 409 when idle.")
  public ResponseEntity<RecordingSession.SessionSnapshot> setPaused(
      @Valid @RequestBody PausedRequest request) {
    if (!session.setPaused(request.paused())) {
      return ResponseEntity.status(HttpStatus.CONFLICT).build();
    }
    return ResponseEntity.ok(session.snapshot());
  }

  @GetMapping("/recordings/{recordingId}/references")
  @Operation(summary = "Blocks tagged against a recording, ordered by offset")
  public List<AudioReference> references(@PathVariable String recordingId) {
    return store.findReferences(recordingId);
  }

  @GetMapping("/notes/{noteId}/recordings")
  @Operation(summary = "Recordings made into a note, oldest first")
  public List<AudioRecording> recordingsForNote(@PathVariable String noteId) {
    return store.findRecordingsForNote(noteId);
  }
}
