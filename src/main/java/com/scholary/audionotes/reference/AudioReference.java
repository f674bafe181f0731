package com.scholary.audionotes.reference;

/**
 * Association between a block and a moment in a recording.
 *
 * <p>The auto-tagger writes at most one reference per {@code (recordingId, blockId)} pair.
 *
 * @param recordingId the recording the offset belongs to
 * @param blockId the block that was being written at that moment
 * @param offsetMs milliseconds since the recording started
 * @param endOffsetMs optional end of the span, exclusive
 */
public record AudioReference(String recordingId, String blockId, long offsetMs, Long endOffsetMs) {

  public AudioReference {
    if (recordingId == null || recordingId.isBlank()) {
      throw new IllegalArgumentException("Recording id cannot be blank");
    }
    if (blockId == null || blockId.isBlank()) {
      throw new IllegalArgumentException("Block id cannot be blank");
    }
    if (offsetMs < 0) {
      throw new IllegalArgumentException("Offset cannot be negative");
    }
    if (endOffsetMs != null && endOffsetMs <= offsetMs) {
      throw new IllegalArgumentException("End offset must be after the start offset");
    }
  }

  public static AudioReference at(String recordingId, String blockId, long offsetMs) {
    return new AudioReference(recordingId, blockId, offsetMs, null);
  }
}
