package com.scholary.audionotes.reference;

import java.time.Instant;

/**
 * Metadata of one capture.
 *
 * @param id recording id
 * @param noteId the note that was open when capture started
 * @param filePath where the capture collaborator wrote the audio
 * @param durationMs null while capturing, or when finalization failed
 * @param createdAt when capture started
 */
public record AudioRecording(
    String id, String noteId, String filePath, Long durationMs, Instant createdAt) {

  public AudioRecording {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Recording id cannot be blank");
    }
    if (createdAt == null) {
      throw new IllegalArgumentException("Creation time cannot be null");
    }
  }

  public AudioRecording withDurationMs(Long newDurationMs) {
    return new AudioRecording(id, noteId, filePath, newDurationMs, createdAt);
  }
}
