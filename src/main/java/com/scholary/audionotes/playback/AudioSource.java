package com.scholary.audionotes.playback;

/**
 * A playable audio file supplied by the host (a browser element, a native player, ...).
 *
 * <p>All positions are absolute milliseconds within the file.
 */
public interface AudioSource {

  /** Start loading; progress is reported to the listener. */
  void open(AudioSourceListener listener);

  void play();

  void pause();

  void seekTo(long positionMs);

  void setMuted(boolean muted);

  /** Release the underlying resource. No callbacks may follow. */
  void close();
}
