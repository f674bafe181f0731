package com.scholary.audionotes.playback;

/**
 * Callbacks from an {@link AudioSource}.
 *
 * <p>Sources may call these from their own threads.
 */
public interface AudioSourceListener {

  /** The source knows its duration and can be played and seeked. */
  void onMetadata(long durationMs);

  /** Periodic playback position, in milliseconds from the start of the file. */
  void onTimeUpdate(long positionMs);

  /** Playback reached the end of the file. */
  void onEnded();

  void onError(Throwable error);
}
