package com.scholary.audionotes.recording;

/**
 * Exception thrown when the capture device cannot start or finalize a recording.
 *
 * <p>The session is always IDLE after this is thrown.
 */
public class CaptureException extends RuntimeException {

  public CaptureException(String message) {
    super(message);
  }

  public CaptureException(String message, Throwable cause) {
    super(message, cause);
  }
}
