package com.scholary.audionotes.reference;

import java.net.URI;

/** Turns a stored recording path into something an audio source can open. */
public interface PlayableHandleResolver {

  /**
   * Resolve a file path to a playable handle.
   *
   * @throws com.scholary.audionotes.playback.SourceLoadException if the path cannot be resolved
   */
  URI resolvePlayableHandle(String filePath);
}
