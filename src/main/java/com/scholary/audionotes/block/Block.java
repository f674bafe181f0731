package com.scholary.audionotes.block;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A node of the document tree.
 *
 * <p>Blocks are immutable values. The tree replaces a block with a modified copy ({@link
 * #withText}, {@link #withPayload}) whenever its content or child list changes, so a {@code Block}
 * handed out by {@link BlockTree} is a stable snapshot of that node.
 *
 * @param id stable identifier, unique within a document
 * @param type the block kind
 * @param text inline runs; always empty for kinds that do not bear text
 * @param payload kind-specific data matching {@link BlockType#payloadType()}, or null
 * @param children ordered child block ids
 */
public record Block(
    String id, BlockType type, List<TextRun> text, BlockPayload payload, List<String> children) {

  public Block {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Block id cannot be blank");
    }
    if (type == null) {
      throw new IllegalArgumentException("Block type cannot be null");
    }
    text = text == null ? List.of() : List.copyOf(text);
    children = children == null ? List.of() : List.copyOf(children);

    if (!type.isTextBearing() && !text.isEmpty()) {
      throw new IllegalArgumentException(type.wireName() + " blocks cannot carry text");
    }

    Class<? extends BlockPayload> expected = type.payloadType();
    if (expected == null && payload != null) {
      throw new IllegalArgumentException(type.wireName() + " blocks carry no payload");
    }
    if (expected != null && !expected.isInstance(payload)) {
      throw new IllegalArgumentException(
          type.wireName() + " blocks require a " + expected.getSimpleName() + " payload");
    }
  }

  public Block withText(List<TextRun> newText) {
    return new Block(id, type, newText, payload, children);
  }

  public Block withPayload(BlockPayload newPayload) {
    return new Block(id, type, text, newPayload, children);
  }

  Block withChildren(List<String> newChildren) {
    return new Block(id, type, text, payload, newChildren);
  }

  /** Concatenated run text without format information. */
  public String plainText() {
    return text.stream().map(TextRun::text).collect(Collectors.joining());
  }

  /**
   * Typed access to the payload.
   *
   * @throws IllegalStateException if the payload is not of the requested variant
   */
  public <T extends BlockPayload> T payloadAs(Class<T> payloadType) {
    if (!payloadType.isInstance(payload)) {
      throw new IllegalStateException(
          "Block " + id + " has no " + payloadType.getSimpleName() + " payload");
    }
    return payloadType.cast(payload);
  }
}
