package com.scholary.audionotes.service;

/** Thrown when a note is neither open nor stored. */
public class NoteNotFoundException extends RuntimeException {

  public NoteNotFoundException(String message) {
    super(message);
  }

  public NoteNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
