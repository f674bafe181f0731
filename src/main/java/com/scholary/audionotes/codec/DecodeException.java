package com.scholary.audionotes.codec;

/**
 * Thrown when a snapshot payload cannot be turned into a valid document.
 *
 * <p>Decoding is all-or-nothing: when this is thrown no tree has been produced, and the input is
 * never repaired.
 */
public class DecodeException extends RuntimeException {

  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
