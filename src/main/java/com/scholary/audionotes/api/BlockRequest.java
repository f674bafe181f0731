package com.scholary.audionotes.api;

import com.scholary.audionotes.block.BlockPayload;
import com.scholary.audionotes.block.BlockType;
import com.scholary.audionotes.block.StructuralException;
import com.scholary.audionotes.block.TextRun;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Locale;

/**
 * Request to add a block to a note.
 *
 * <p>{@code type} uses the snapshot kind names ({@code paragraph}, {@code list-item}, ...). Only
 * the payload fields of that kind are read; the rest are ignored.
 *
 * @param parentId parent block id, or null for the root
 * @param index position among the parent's children; null or negative appends
 * @param text plain text of text-bearing kinds
 */
public record BlockRequest(
    @NotBlank String type,
    String parentId,
    Integer index,
    String text,
    Integer level,
    String listStyle,
    String marker,
    String language,
    String url,
    String recordingId,
    String filePath,
    Long startOffsetMs,
    Long endOffsetMs,
    String targetBlockId,
    String targetNoteId,
    String previewText,
    String targetTitle) {

  BlockType blockType() {
    return BlockType.fromWireName(type)
        .orElseThrow(() -> new StructuralException("Unknown block type: " + type));
  }

  int position() {
    return index == null ? -1 : index;
  }

  List<TextRun> runs() {
    return text == null || text.isEmpty() ? List.of() : List.of(TextRun.plain(text));
  }

  /**
   * Payload of the requested kind built from the matching fields.
   *
   * @throws StructuralException if a required field is missing or invalid
   */
  BlockPayload payload(BlockType blockType) {
    try {
      return switch (blockType) {
        case HEADING -> new BlockPayload.Heading(require(level, "level"));
        case LIST_ITEM -> listItem();
        case CODE -> new BlockPayload.Code(language);
        case LINK -> new BlockPayload.Link(url);
        case AUDIO_BLOCK ->
            new BlockPayload.Audio(
                recordingId, filePath, require(startOffsetMs, "startOffsetMs"), endOffsetMs);
        case BLOCK_REFERENCE ->
            new BlockPayload.Reference(targetBlockId, targetNoteId, previewText);
        case BACKLINK -> new BlockPayload.Backlink(targetNoteId, targetTitle);
        case ROOT, PARAGRAPH, QUOTE -> null;
      };
    } catch (IllegalArgumentException e) {
      throw new StructuralException(
          "Invalid " + blockType.wireName() + " block: " + e.getMessage(), e);
    }
  }

  private BlockPayload.ListItem listItem() {
    BlockPayload.ListStyle style =
        listStyle == null
            ? BlockPayload.ListStyle.BULLET
            : BlockPayload.ListStyle.valueOf(listStyle.toUpperCase(Locale.ROOT));
    if (marker == null || marker.isEmpty()) {
      return style == BlockPayload.ListStyle.BULLET
          ? BlockPayload.ListItem.bullet()
          : BlockPayload.ListItem.ordered();
    }
    if (marker.length() != 1) {
      throw new IllegalArgumentException("List marker must be a single character");
    }
    return new BlockPayload.ListItem(style, marker.charAt(0));
  }

  private static <T> T require(T value, String field) {
    if (value == null) {
      throw new IllegalArgumentException("Missing required field '" + field + "'");
    }
    return value;
  }
}
