package com.scholary.audionotes.block;

/** A change to one block, reported once per block per {@link BlockTree#mutate} batch. */
public record MutationEvent(Type type, String blockId) {

  public enum Type {
    CREATED,
    UPDATED,
    REMOVED
  }

  public static MutationEvent created(String blockId) {
    return new MutationEvent(Type.CREATED, blockId);
  }

  public static MutationEvent updated(String blockId) {
    return new MutationEvent(Type.UPDATED, blockId);
  }

  public static MutationEvent removed(String blockId) {
    return new MutationEvent(Type.REMOVED, blockId);
  }
}
