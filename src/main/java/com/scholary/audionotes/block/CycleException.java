package com.scholary.audionotes.block;

/** Thrown when a move would place a block underneath itself. The tree is left unchanged. */
public class CycleException extends StructuralException {

  public CycleException(String message) {
    super(message);
  }
}
