package com.scholary.audionotes.playback;

/** Formatting helpers for player and markup time displays. */
public final class PlaybackTimes {

  private PlaybackTimes() {}

  /**
   * Format a millisecond offset as {@code mm:ss}.
   *
   * <p>Seconds are floored. Minutes are not wrapped into hours, so an offset of 75 minutes prints
   * as {@code 75:00}. Negative input is treated as zero.
   */
  public static String format(long millis) {
    long totalSeconds = Math.max(0, millis) / 1000;
    return String.format("%02d:%02d", totalSeconds / 60, totalSeconds % 60);
  }
}
