package com.scholary.audionotes.block;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of block kinds a note document can contain.
 *
 * <p>Every operation that behaves differently per kind (containment, snapshot mapping, markup
 * export, auto-tag eligibility) switches over this enum, so adding a kind is a compile-time
 * visible change rather than a runtime type probe.
 */
public enum BlockType {
  ROOT("root"),
  PARAGRAPH("paragraph"),
  HEADING("heading"),
  LIST_ITEM("list-item"),
  QUOTE("quote"),
  CODE("code"),
  LINK("link"),
  AUDIO_BLOCK("audio-block"),
  BLOCK_REFERENCE("block-reference"),
  BACKLINK("backlink");

  private final String wireName;

  BlockType(String wireName) {
    this.wireName = wireName;
  }

  /** Name used in the snapshot format. */
  public String wireName() {
    return wireName;
  }

  /** Whether blocks of this kind carry inline text runs. */
  public boolean isTextBearing() {
    return switch (this) {
      case PARAGRAPH, HEADING, LIST_ITEM, QUOTE, CODE, LINK -> true;
      case ROOT, AUDIO_BLOCK, BLOCK_REFERENCE, BACKLINK -> false;
    };
  }

  /** Whether this kind is rendered inside the text flow of its parent. */
  public boolean isInline() {
    return switch (this) {
      case LINK, AUDIO_BLOCK, BLOCK_REFERENCE, BACKLINK -> true;
      case ROOT, PARAGRAPH, HEADING, LIST_ITEM, QUOTE, CODE -> false;
    };
  }

  /**
   * Containment rule between a parent of this kind and a child kind.
   *
   * @param child the kind of the prospective child
   * @return true if a block of this kind may hold a child of the given kind
   */
  public boolean canContain(BlockType child) {
    if (child == ROOT) {
      return false;
    }
    return switch (this) {
      case ROOT -> true;
      case PARAGRAPH, HEADING -> child.isInline();
      case LIST_ITEM -> child == LIST_ITEM || child.isInline();
      case QUOTE -> child == PARAGRAPH || child.isInline();
      case CODE, LINK, AUDIO_BLOCK, BLOCK_REFERENCE, BACKLINK -> false;
    };
  }

  /** The payload class blocks of this kind must carry, or null for kinds without payload. */
  public Class<? extends BlockPayload> payloadType() {
    return switch (this) {
      case HEADING -> BlockPayload.Heading.class;
      case LIST_ITEM -> BlockPayload.ListItem.class;
      case CODE -> BlockPayload.Code.class;
      case LINK -> BlockPayload.Link.class;
      case AUDIO_BLOCK -> BlockPayload.Audio.class;
      case BLOCK_REFERENCE -> BlockPayload.Reference.class;
      case BACKLINK -> BlockPayload.Backlink.class;
      case ROOT, PARAGRAPH, QUOTE -> null;
    };
  }

  public static Optional<BlockType> fromWireName(String wireName) {
    return Arrays.stream(values()).filter(t -> t.wireName.equals(wireName)).findFirst();
  }
}
