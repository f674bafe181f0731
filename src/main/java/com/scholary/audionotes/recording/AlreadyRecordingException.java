package com.scholary.audionotes.recording;

/** Thrown when a recording is started while another one is still active. */
public class AlreadyRecordingException extends RuntimeException {

  public AlreadyRecordingException(String message) {
    super(message);
  }

  public AlreadyRecordingException(String message, Throwable cause) {
    super(message, cause);
  }
}
