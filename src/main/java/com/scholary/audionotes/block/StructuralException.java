package com.scholary.audionotes.block;

/**
 * Thrown when a tree operation would break the document structure.
 *
 * <p>The operation is rejected and the tree is left exactly as it was before the call.
 */
public class StructuralException extends RuntimeException {

  public StructuralException(String message) {
    super(message);
  }

  public StructuralException(String message, Throwable cause) {
    super(message, cause);
  }
}
