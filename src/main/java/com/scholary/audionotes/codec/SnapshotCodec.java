package com.scholary.audionotes.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audionotes.block.Block;
import com.scholary.audionotes.block.BlockPayload;
import com.scholary.audionotes.block.BlockTree;
import com.scholary.audionotes.block.BlockType;
import com.scholary.audionotes.block.StructuralException;
import com.scholary.audionotes.block.TextFormat;
import com.scholary.audionotes.block.TextRun;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Lossless JSON snapshot format for block trees.
 *
 * <p>This is the persisted layout of a note: every field of every block kind survives {@code
 * fromSnapshot(toSnapshot(tree))} unchanged, ids included. Decoding is strict about structure (a
 * dangling child id, a second parent, a cycle or a missing required field fails the whole decode)
 * and lenient about unknown fields, which a newer writer may have added.
 */
@Component
public class SnapshotCodec {

  private static final Logger LOGGER = LoggerFactory.getLogger(SnapshotCodec.class);

  static final int FORMAT_VERSION = 1;
  static final int BLOCK_VERSION = 1;

  private final ObjectMapper objectMapper;

  public SnapshotCodec(ObjectMapper objectMapper) {
    this.objectMapper =
        objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * Encode a tree.
   *
   * @param tree the document to encode
   * @return UTF-8 JSON bytes
   */
  public byte[] toSnapshot(BlockTree tree) {
    List<SnapshotDocument.Block> blocks = new ArrayList<>();
    for (Block block : tree.blocksInOrder()) {
      blocks.add(encodeBlock(block));
    }
    SnapshotDocument document = new SnapshotDocument(FORMAT_VERSION, tree.rootId(), blocks);
    try {
      return objectMapper.writeValueAsBytes(document);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode snapshot", e);
    }
  }

  public BlockTree fromSnapshot(byte[] snapshot) {
    return fromSnapshot(snapshot, () -> UUID.randomUUID().toString());
  }

  /**
   * Decode a snapshot.
   *
   * @param snapshot UTF-8 JSON bytes produced by {@link #toSnapshot}
   * @param idGenerator id source for blocks created after loading
   * @return the restored tree
   * @throws DecodeException if the payload is malformed or structurally invalid
   */
  public BlockTree fromSnapshot(byte[] snapshot, Supplier<String> idGenerator) {
    if (snapshot == null || snapshot.length == 0) {
      throw new DecodeException("Snapshot is empty");
    }

    SnapshotDocument document;
    try {
      document = objectMapper.readValue(snapshot, SnapshotDocument.class);
    } catch (JsonProcessingException e) {
      throw new DecodeException("Snapshot is not valid JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new DecodeException("Snapshot could not be read: " + e.getMessage(), e);
    }

    if (document == null) {
      throw new DecodeException("Snapshot is empty");
    }
    if (document.formatVersion() == null) {
      throw new DecodeException("Snapshot is missing required field 'formatVersion'");
    }
    if (document.formatVersion() > FORMAT_VERSION) {
      throw new DecodeException(
          "Unsupported snapshot formatVersion " + document.formatVersion());
    }
    if (document.rootId() == null) {
      throw new DecodeException("Snapshot is missing required field 'rootId'");
    }
    if (document.blocks() == null) {
      throw new DecodeException("Snapshot is missing required field 'blocks'");
    }

    List<Block> blocks = new ArrayList<>(document.blocks().size());
    for (SnapshotDocument.Block wire : document.blocks()) {
      blocks.add(decodeBlock(wire));
    }

    try {
      BlockTree tree = BlockTree.restore(document.rootId(), blocks, idGenerator);
      LOGGER.debug("Decoded snapshot: rootId={}, blocks={}", tree.rootId(), tree.size());
      return tree;
    } catch (StructuralException e) {
      throw new DecodeException("Snapshot structure is invalid: " + e.getMessage(), e);
    }
  }

  // ---- encoding ----

  private SnapshotDocument.Block encodeBlock(Block block) {
    List<String> children = block.children().isEmpty() ? null : block.children();
    List<SnapshotDocument.Run> text = block.type().isTextBearing() ? encodeRuns(block) : null;

    Integer level = null;
    String listStyle = null;
    String marker = null;
    String language = null;
    String url = null;
    String recordingId = null;
    String filePath = null;
    Long startOffsetMs = null;
    Long endOffsetMs = null;
    String targetBlockId = null;
    String targetNoteId = null;
    String previewText = null;
    String targetTitle = null;

    switch (block.type()) {
      case HEADING -> level = block.payloadAs(BlockPayload.Heading.class).level();
      case LIST_ITEM -> {
        BlockPayload.ListItem item = block.payloadAs(BlockPayload.ListItem.class);
        listStyle = item.style().name().toLowerCase(Locale.ROOT);
        marker = String.valueOf(item.marker());
      }
      case CODE -> language = block.payloadAs(BlockPayload.Code.class).language();
      case LINK -> url = block.payloadAs(BlockPayload.Link.class).url();
      case AUDIO_BLOCK -> {
        BlockPayload.Audio audio = block.payloadAs(BlockPayload.Audio.class);
        recordingId = audio.recordingId();
        filePath = audio.filePath();
        startOffsetMs = audio.startOffsetMs();
        endOffsetMs = audio.endOffsetMs();
      }
      case BLOCK_REFERENCE -> {
        BlockPayload.Reference reference = block.payloadAs(BlockPayload.Reference.class);
        targetBlockId = reference.targetBlockId();
        targetNoteId = reference.targetNoteId();
        previewText = reference.previewText();
      }
      case BACKLINK -> {
        BlockPayload.Backlink backlink = block.payloadAs(BlockPayload.Backlink.class);
        targetNoteId = backlink.targetNoteId();
        targetTitle = backlink.targetTitle();
      }
      case ROOT, PARAGRAPH, QUOTE -> {
        // no payload
      }
    }

    return new SnapshotDocument.Block(
        block.id(),
        block.type().wireName(),
        BLOCK_VERSION,
        children,
        text,
        level,
        listStyle,
        marker,
        language,
        url,
        recordingId,
        filePath,
        startOffsetMs,
        endOffsetMs,
        targetBlockId,
        targetNoteId,
        previewText,
        targetTitle);
  }

  private List<SnapshotDocument.Run> encodeRuns(Block block) {
    List<SnapshotDocument.Run> runs = new ArrayList<>(block.text().size());
    for (TextRun run : block.text()) {
      List<String> format =
          run.formats().isEmpty()
              ? null
              : EnumSet.copyOf(run.formats()).stream()
                  .map(f -> f.name().toLowerCase(Locale.ROOT))
                  .toList();
      runs.add(new SnapshotDocument.Run(run.text(), format));
    }
    return runs;
  }

  // ---- decoding ----

  private Block decodeBlock(SnapshotDocument.Block wire) {
    if (wire == null) {
      throw new DecodeException("Snapshot contains a null block entry");
    }
    String id = require(wire.id(), "id", "?");
    String typeName = require(wire.type(), "type", id);
    BlockType type =
        BlockType.fromWireName(typeName)
            .orElseThrow(
                () -> new DecodeException("Block " + id + " has unknown type '" + typeName + "'"));
    Integer version = require(wire.version(), "version", id);
    if (version > BLOCK_VERSION) {
      LOGGER.debug(
          "Decoding newer block layout: id={}, type={}, version={}", id, typeName, version);
    }

    List<TextRun> text = decodeRuns(wire.text(), id);
    if (wire.children() != null && wire.children().contains(null)) {
      throw new DecodeException("Block " + id + " has a null child id");
    }
    try {
      return new Block(id, type, text, decodePayload(wire, type, id), wire.children());
    } catch (IllegalArgumentException e) {
      throw new DecodeException("Block " + id + " is invalid: " + e.getMessage(), e);
    }
  }

  private BlockPayload decodePayload(SnapshotDocument.Block wire, BlockType type, String id) {
    return switch (type) {
      case HEADING -> new BlockPayload.Heading(require(wire.level(), "level", id));
      case LIST_ITEM -> decodeListItem(wire, id);
      case CODE -> new BlockPayload.Code(wire.language());
      case LINK -> new BlockPayload.Link(require(wire.url(), "url", id));
      case AUDIO_BLOCK ->
          new BlockPayload.Audio(
              require(wire.recordingId(), "recordingId", id),
              require(wire.filePath(), "filePath", id),
              require(wire.startOffsetMs(), "startOffsetMs", id),
              wire.endOffsetMs());
      case BLOCK_REFERENCE ->
          new BlockPayload.Reference(
              require(wire.targetBlockId(), "targetBlockId", id),
              require(wire.targetNoteId(), "targetNoteId", id),
              wire.previewText());
      case BACKLINK ->
          new BlockPayload.Backlink(
              require(wire.targetNoteId(), "targetNoteId", id), wire.targetTitle());
      case ROOT, PARAGRAPH, QUOTE -> null;
    };
  }

  private BlockPayload.ListItem decodeListItem(SnapshotDocument.Block wire, String id) {
    String styleName = require(wire.listStyle(), "listStyle", id);
    BlockPayload.ListStyle style;
    try {
      style = BlockPayload.ListStyle.valueOf(styleName.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new DecodeException("Block " + id + " has unknown listStyle '" + styleName + "'", e);
    }
    String marker = require(wire.marker(), "marker", id);
    if (marker.length() != 1) {
      throw new DecodeException("Block " + id + " has invalid list marker '" + marker + "'");
    }
    return new BlockPayload.ListItem(style, marker.charAt(0));
  }

  private List<TextRun> decodeRuns(List<SnapshotDocument.Run> runs, String id) {
    if (runs == null) {
      return List.of();
    }
    List<TextRun> decoded = new ArrayList<>(runs.size());
    for (SnapshotDocument.Run run : runs) {
      if (run == null) {
        throw new DecodeException("Block " + id + " contains a null text run");
      }
      Set<TextFormat> formats = EnumSet.noneOf(TextFormat.class);
      if (run.format() != null) {
        for (String name : run.format()) {
          try {
            formats.add(TextFormat.valueOf(name.toUpperCase(Locale.ROOT)));
          } catch (IllegalArgumentException | NullPointerException e) {
            throw new DecodeException("Block " + id + " has unknown text format '" + name + "'", e);
          }
        }
      }
      decoded.add(new TextRun(run.text() == null ? "" : run.text(), formats));
    }
    return decoded;
  }

  private static <T> T require(T value, String field, String blockId) {
    if (value == null) {
      throw new DecodeException(
          "Block " + blockId + " is missing required field '" + field + "'");
    }
    return value;
  }
}
