package com.scholary.audionotes.playback;

/**
 * The playable part of a recording, in absolute milliseconds.
 *
 * <p>Used by the player to bound positions. Both ends are inclusive for clamping.
 */
public record ClipRange(long startMs, long endMs) {

  public ClipRange {
    if (startMs < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (endMs < startMs) {
      throw new IllegalArgumentException("End time must be >= start time");
    }
  }

  /**
   * Fit requested bounds into a file of known length.
   *
   * <p>A missing start means the beginning of the file, a missing end means its end. The start is
   * clamped into the file and the end never falls before the start.
   */
  public static ClipRange within(Long requestedStartMs, Long requestedEndMs, long durationMs) {
    long duration = Math.max(0, durationMs);
    long start =
        requestedStartMs == null ? 0 : Math.min(Math.max(requestedStartMs, 0), duration);
    long end =
        requestedEndMs == null ? duration : Math.max(start, Math.min(requestedEndMs, duration));
    return new ClipRange(start, end);
  }

  public long lengthMs() {
    return endMs - startMs;
  }

  /**
   * Check if this range contains a given position.
   *
   * @return true if the position is within [start, end]
   */
  public boolean contains(long positionMs) {
    return positionMs >= startMs && positionMs <= endMs;
  }

  public long clamp(long positionMs) {
    return Math.min(Math.max(positionMs, startMs), endMs);
  }
}
