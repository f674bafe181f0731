package com.scholary.audionotes.playback;

/**
 * Thrown when a recording cannot be turned into a playable source.
 *
 * <p>The player catches this and moves to ERROR; it never reaches the document.
 */
public class SourceLoadException extends RuntimeException {

  public SourceLoadException(String message) {
    super(message);
  }

  public SourceLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
