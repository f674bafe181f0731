package com.scholary.audionotes.recording;

import com.scholary.audionotes.logging.StructuredLogger;
import com.scholary.audionotes.reference.AudioRecording;
import com.scholary.audionotes.reference.AudioReferenceStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * The process-wide recording state.
 *
 * <p>There is exactly one session per application instance, and every transition goes through
 * {@link #start} and {@link #stop}. The offset reported by {@link #pollOffsetMs()} is derived from
 * the wall clock at poll time rather than from the capture device, which keeps tagging cheap and
 * independent of audio buffering.
 *
 * <p>All methods are synchronized: request threads start and stop recordings while the
 * auto-tagger polls offsets from whichever thread commits an edit.
 */
@Service
public class RecordingSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordingSession.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final CaptureService captureService;
  private final AudioReferenceStore store;
  private final Clock clock;

  private RecordingStatus status = RecordingStatus.IDLE;
  private AudioRecording current;
  private Instant startedAt;
  private long lastPolledOffsetMs;
  private boolean paused;

  public RecordingSession(CaptureService captureService, AudioReferenceStore store, Clock clock) {
    this.captureService = captureService;
    this.store = store;
    this.clock = clock;
  }

  /**
   * Start recording into a note.
   *
   * @param noteId the note the recording belongs to
   * @return metadata of the new recording, with no duration yet
   * @throws AlreadyRecordingException if a recording is already active
   * @throws CaptureException if the capture device could not start; the session stays IDLE
   * @throws RuntimeException if the recording could not be stored; capture is stopped again and
   *     the session stays IDLE
   */
  public synchronized AudioRecording start(String noteId) {
    if (status == RecordingStatus.ACTIVE) {
      throw new AlreadyRecordingException(
          "Already recording: recordingId=" + current.id() + ", noteId=" + current.noteId());
    }

    String recordingId = UUID.randomUUID().toString();
    Instant now = clock.instant();

    String filePath;
    try {
      filePath = captureService.beginCapture(noteId, recordingId);
    } catch (CaptureException e) {
      STRUCTURED_LOGGER.logCaptureFailed(recordingId, "begin", e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      STRUCTURED_LOGGER.logCaptureFailed(recordingId, "begin", e.getMessage());
      throw new CaptureException("Failed to start capture: " + e.getMessage(), e);
    }

    AudioRecording recording = new AudioRecording(recordingId, noteId, filePath, null, now);
    try {
      store.saveRecording(recording);
    } catch (RuntimeException e) {
      LOGGER.error("Failed to store recording, stopping capture: recordingId={}", recordingId, e);
      try {
        captureService.endCapture(recordingId);
      } catch (RuntimeException stopFailure) {
        e.addSuppressed(stopFailure);
      }
      throw e;
    }

    current = recording;
    startedAt = now;
    lastPolledOffsetMs = 0;
    paused = false;
    status = RecordingStatus.ACTIVE;

    STRUCTURED_LOGGER.logRecordingStarted(recordingId, noteId, filePath);
    return recording;
  }

  /**
   * Stop the active recording.
   *
   * <p>The session is IDLE when this returns or throws. If the capture device fails to finalize,
   * the recording is kept without a duration and the failure is rethrown.
   *
   * @return the completed recording, or empty if nothing was recording
   * @throws CaptureException if finalization failed
   */
  public synchronized Optional<AudioRecording> stop() {
    if (status == RecordingStatus.IDLE) {
      LOGGER.debug("Stop requested while idle");
      return Optional.empty();
    }

    AudioRecording recording = current;
    RuntimeException failure = null;
    Long durationMs = null;
    try {
      durationMs = captureService.endCapture(recording.id());
    } catch (RuntimeException e) {
      STRUCTURED_LOGGER.logCaptureFailed(recording.id(), "end", e.getMessage());
      failure = e;
    } finally {
      clear();
    }

    AudioRecording completed = recording.withDurationMs(durationMs);
    store.saveRecording(completed);
    STRUCTURED_LOGGER.logRecordingStopped(completed.id(), completed.noteId(), durationMs);

    if (failure instanceof CaptureException captureFailure) {
      throw captureFailure;
    }
    if (failure != null) {
      throw new CaptureException("Failed to finalize capture: " + failure.getMessage(), failure);
    }
    return Optional.of(completed);
  }

  /**
   * Milliseconds elapsed since the active recording started.
   *
   * @return the offset, never negative; 0 while IDLE
   */
  public synchronized long pollOffsetMs() {
    if (status == RecordingStatus.IDLE) {
      return 0;
    }
    long offset = Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
    lastPolledOffsetMs = offset;
    return offset;
  }

  /** The offset returned by the most recent poll of the active recording. */
  public synchronized long lastPolledOffsetMs() {
    return lastPolledOffsetMs;
  }

  public synchronized RecordingStatus status() {
    return status;
  }

  public synchronized boolean isActive() {
    return status == RecordingStatus.ACTIVE;
  }

  public synchronized Optional<String> currentRecordingId() {
    return Optional.ofNullable(current).map(AudioRecording::id);
  }

  public synchronized Optional<String> currentNoteId() {
    return Optional.ofNullable(current).map(AudioRecording::noteId);
  }

  public synchronized Optional<AudioRecording> currentRecording() {
    return Optional.ofNullable(current);
  }

  /**
   * Flip the paused flag of the active recording.
   *
   * <p>This only changes what {@link #snapshot()} reports. Capture keeps running and offsets keep
   * advancing while paused.
   *
   * @return false if nothing is recording
   */
  public synchronized boolean setPaused(boolean paused) {
    if (status == RecordingStatus.IDLE) {
      return false;
    }
    this.paused = paused;
    LOGGER.info("Recording paused flag changed: recordingId={}, paused={}", current.id(), paused);
    return true;
  }

  /** Immutable view of the session, with the offset polled now. */
  public synchronized SessionSnapshot snapshot() {
    if (status == RecordingStatus.IDLE) {
      return new SessionSnapshot(RecordingStatus.IDLE, null, null, null, 0, false);
    }
    long offset = pollOffsetMs();
    return new SessionSnapshot(status, current.id(), current.noteId(), startedAt, offset, paused);
  }

  private void clear() {
    status = RecordingStatus.IDLE;
    current = null;
    startedAt = null;
    lastPolledOffsetMs = 0;
    paused = false;
  }

  /**
   * Point-in-time view of the session.
   *
   * @param recordingId null while IDLE
   * @param noteId null while IDLE
   * @param startedAt null while IDLE
   */
  public record SessionSnapshot(
      RecordingStatus status,
      String recordingId,
      String noteId,
      Instant startedAt,
      long offsetMs,
      boolean paused) {}
}
