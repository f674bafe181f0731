package com.scholary.audionotes.reference;

import java.util.List;
import java.util.Optional;

/**
 * Storage for recordings and the block references pointing into them.
 *
 * <p>Implementations must be safe to call from the auto-tag worker threads and request threads
 * at the same time.
 */
public interface AudioReferenceStore {

  /**
   * Store a reference unless one already exists for the same recording and block.
   *
   * @return true if the reference was created, false if an earlier one was kept
   */
  boolean putAudioReference(AudioReference reference);

  /** References of a recording ordered by offset. */
  List<AudioReference> findReferences(String recordingId);

  Optional<AudioReference> findReference(String recordingId, String blockId);

  /** Insert or replace recording metadata. */
  void saveRecording(AudioRecording recording);

  Optional<AudioRecording> findRecording(String recordingId);

  /** Recordings of a note, oldest first. */
  List<AudioRecording> findRecordingsForNote(String noteId);
}
