package com.scholary.audionotes.playback;

import java.net.URI;

/** Creates host audio sources for resolved playable handles. */
@FunctionalInterface
public interface AudioSourceFactory {

  /**
   * Create a source for a handle.
   *
   * @throws SourceLoadException if the host cannot play the handle
   */
  AudioSource create(URI handle);
}
