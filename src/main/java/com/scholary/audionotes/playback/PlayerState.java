package com.scholary.audionotes.playback;

public enum PlayerState {
  /** No source loaded. */
  IDLE,
  /** Source attached, waiting for its duration. */
  LOADING,
  READY,
  PLAYING,
  PAUSED,
  /** Reached the end bound of the clip or the end of the file. */
  ENDED,
  ERROR
}
