package com.scholary.audionotes.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audionotes.block.Block;
import com.scholary.audionotes.block.BlockPayload;
import com.scholary.audionotes.block.BlockTree;
import com.scholary.audionotes.block.BlockType;
import com.scholary.audionotes.block.TextFormat;
import com.scholary.audionotes.block.TextRun;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SnapshotCodecTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private SnapshotCodec codec;

  @BeforeEach
  void setUp() {
    codec = new SnapshotCodec(objectMapper);
  }

  @Test
  void toSnapshot_shouldPreserveEveryBlockKind() {
    BlockTree tree = richTree();

    BlockTree decoded = codec.fromSnapshot(codec.toSnapshot(tree));

    assertThat(decoded.contentEquals(tree)).isTrue();
    assertThat(decoded.rootId()).isEqualTo(tree.rootId());
  }

  @Test
  void toSnapshot_shouldWriteVersionedFlatLayout() throws Exception {
    AtomicInteger counter = new AtomicInteger();
    BlockTree tree = new BlockTree(() -> "b" + counter.getAndIncrement());
    tree.createBlock(
        BlockType.PARAGRAPH,
        tree.rootId(),
        -1,
        List.of(TextRun.of("Hello", TextFormat.BOLD, TextFormat.ITALIC)),
        null);

    JsonNode json = objectMapper.readTree(codec.toSnapshot(tree));

    assertThat(json.get("formatVersion").asInt()).isEqualTo(1);
    assertThat(json.get("rootId").asText()).isEqualTo("b0");
    assertThat(json.get("blocks")).hasSize(2);
    JsonNode paragraph = json.get("blocks").get(1);
    assertThat(paragraph.get("type").asText()).isEqualTo("paragraph");
    assertThat(paragraph.get("version").asInt()).isEqualTo(1);
    assertThat(paragraph.get("text").get(0).get("format").toString())
        .isEqualTo("[\"bold\",\"italic\"]");
    assertThat(paragraph.has("children")).isFalse();
  }

  @Test
  void fromSnapshot_shouldIgnoreUnknownFields() {
    String json =
        """
        {"formatVersion": 1, "rootId": "r", "writer": "future",
         "blocks": [
           {"id": "r", "type": "root", "version": 1, "children": ["h"]},
           {"id": "h", "type": "heading", "version": 2, "level": 2, "anchor": "x",
            "text": [{"text": "Title"}]}
         ]}
        """;

    BlockTree tree = codec.fromSnapshot(bytes(json));

    Block heading = tree.get("h");
    assertThat(heading.payloadAs(BlockPayload.Heading.class).level()).isEqualTo(2);
    assertThat(heading.plainText()).isEqualTo("Title");
  }

  @Test
  void fromSnapshot_shouldRejectEmptyPayload() {
    assertThatThrownBy(() -> codec.fromSnapshot(new byte[0]))
        .isInstanceOf(DecodeException.class);
    assertThatThrownBy(() -> codec.fromSnapshot(null)).isInstanceOf(DecodeException.class);
  }

  @Test
  void fromSnapshot_shouldRejectMalformedJson() {
    assertThatThrownBy(() -> codec.fromSnapshot(bytes("{\"formatVersion\": 1,")))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("not valid JSON");
  }

  @Test
  void fromSnapshot_shouldRejectNewerFormatVersion() {
    String json = "{\"formatVersion\": 2, \"rootId\": \"r\", \"blocks\": []}";

    assertThatThrownBy(() -> codec.fromSnapshot(bytes(json)))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("formatVersion");
  }

  @Test
  void fromSnapshot_shouldRejectMissingRequiredFields() {
    assertThatThrownBy(() -> codec.fromSnapshot(bytes("{\"rootId\": \"r\", \"blocks\": []}")))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("formatVersion");

    String noLevel =
        """
        {"formatVersion": 1, "rootId": "r", "blocks": [
          {"id": "r", "type": "root", "version": 1, "children": ["h"]},
          {"id": "h", "type": "heading", "version": 1}
        ]}
        """;
    assertThatThrownBy(() -> codec.fromSnapshot(bytes(noLevel)))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("'level'");
  }

  @Test
  void fromSnapshot_shouldRejectUnknownBlockType() {
    String json =
        """
        {"formatVersion": 1, "rootId": "r", "blocks": [
          {"id": "r", "type": "root", "version": 1, "children": ["t"]},
          {"id": "t", "type": "table", "version": 1}
        ]}
        """;

    assertThatThrownBy(() -> codec.fromSnapshot(bytes(json)))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("table");
  }

  @Test
  void fromSnapshot_shouldRejectInvalidPayloadValues() {
    String json =
        """
        {"formatVersion": 1, "rootId": "r", "blocks": [
          {"id": "r", "type": "root", "version": 1, "children": ["h"]},
          {"id": "h", "type": "heading", "version": 1, "level": 9}
        ]}
        """;

    assertThatThrownBy(() -> codec.fromSnapshot(bytes(json)))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("Heading level");
  }

  @Test
  void fromSnapshot_shouldRejectDanglingChild() {
    String json =
        """
        {"formatVersion": 1, "rootId": "r", "blocks": [
          {"id": "r", "type": "root", "version": 1, "children": ["ghost"]}
        ]}
        """;

    assertThatThrownBy(() -> codec.fromSnapshot(bytes(json)))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("ghost");
  }

  @Test
  void fromSnapshot_shouldRejectNullChildId() {
    String json =
        """
        {"formatVersion": 1, "rootId": "r", "blocks": [
          {"id": "r", "type": "root", "version": 1, "children": [null]}
        ]}
        """;

    assertThatThrownBy(() -> codec.fromSnapshot(bytes(json)))
        .isInstanceOf(DecodeException.class)
        .hasMessage("Block r has a null child id");
  }

  @Test
  void fromSnapshot_shouldRejectCycles() {
    String json =
        """
        {"formatVersion": 1, "rootId": "r", "blocks": [
          {"id": "r", "type": "root", "version": 1},
          {"id": "a", "type": "list-item", "version": 1, "listStyle": "bullet",
           "marker": "-", "children": ["b"]},
          {"id": "b", "type": "list-item", "version": 1, "listStyle": "bullet",
           "marker": "-", "children": ["a"]}
        ]}
        """;

    assertThatThrownBy(() -> codec.fromSnapshot(bytes(json)))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("cycle");
  }

  @Test
  void fromSnapshot_shouldRejectUnknownTextFormat() {
    String json =
        """
        {"formatVersion": 1, "rootId": "r", "blocks": [
          {"id": "r", "type": "root", "version": 1, "children": ["p"]},
          {"id": "p", "type": "paragraph", "version": 1,
           "text": [{"text": "x", "format": ["blink"]}]}
        ]}
        """;

    assertThatThrownBy(() -> codec.fromSnapshot(bytes(json)))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("blink");
  }

  @Test
  void fromSnapshot_shouldUseGeneratorForLaterBlocks() {
    BlockTree decoded = codec.fromSnapshot(codec.toSnapshot(richTree()), () -> "fresh");

    Block created = decoded.createBlock(BlockType.PARAGRAPH, decoded.rootId(), -1);

    assertThat(created.id()).isEqualTo("fresh");
  }

  private static byte[] bytes(String json) {
    return json.getBytes(StandardCharsets.UTF_8);
  }

  static BlockTree richTree() {
    AtomicInteger counter = new AtomicInteger();
    BlockTree tree = new BlockTree(() -> "b" + counter.getAndIncrement());
    tree.mutate(
        editor -> {
          String root = editor.rootId();
          editor.createBlock(
              BlockType.HEADING,
              root,
              -1,
              List.of(TextRun.plain("Lecture 3")),
              new BlockPayload.Heading(1));
          Block paragraph =
              editor.createBlock(
                  BlockType.PARAGRAPH,
                  root,
                  -1,
                  List.of(
                      TextRun.plain("Plain "),
                      TextRun.of("bold", TextFormat.BOLD),
                      TextRun.of(" under", TextFormat.UNDERLINE, TextFormat.STRIKETHROUGH)),
                  null);
          editor.createBlock(
              BlockType.LINK,
              paragraph.id(),
              -1,
              List.of(TextRun.plain("docs")),
              new BlockPayload.Link("https://example.com/docs"));
          editor.createBlock(
              BlockType.AUDIO_BLOCK,
              paragraph.id(),
              -1,
              List.of(),
              new BlockPayload.Audio("rec-1", "recordings/rec-1.wav", 5000, 25000L));
          Block item =
              editor.createBlock(
                  BlockType.LIST_ITEM,
                  root,
                  -1,
                  List.of(TextRun.plain("first")),
                  new BlockPayload.ListItem(BlockPayload.ListStyle.BULLET, '*'));
          editor.createBlock(
              BlockType.LIST_ITEM,
              item.id(),
              -1,
              List.of(TextRun.plain("nested")),
              BlockPayload.ListItem.ordered());
          editor.createBlock(
              BlockType.BLOCK_REFERENCE,
              item.id(),
              -1,
              List.of(),
              new BlockPayload.Reference("blk-9", "note-2", "preview text"));
          Block quote =
              editor.createBlock(
                  BlockType.QUOTE, root, -1, List.of(TextRun.plain("quoted")), null);
          editor.createBlock(
              BlockType.PARAGRAPH, quote.id(), -1, List.of(TextRun.plain("more")), null);
          editor.createBlock(
              BlockType.CODE,
              root,
              -1,
              List.of(TextRun.plain("int x = 1;")),
              new BlockPayload.Code("java"));
          Block last = editor.createBlock(BlockType.PARAGRAPH, root, -1);
          editor.createBlock(
              BlockType.BACKLINK,
              last.id(),
              -1,
              List.of(),
              new BlockPayload.Backlink("note-3", "Week 2"));
        });
    return tree;
  }
}
