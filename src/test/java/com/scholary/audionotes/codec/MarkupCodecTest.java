package com.scholary.audionotes.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audionotes.block.Block;
import com.scholary.audionotes.block.BlockPayload;
import com.scholary.audionotes.block.BlockTree;
import com.scholary.audionotes.block.BlockType;
import com.scholary.audionotes.block.TextFormat;
import com.scholary.audionotes.block.TextRun;
import java.util.List;
import org.junit.jupiter.api.Test;

class MarkupCodecTest {

  private final MarkupCodec codec = new MarkupCodec('-');

  @Test
  void constructor_shouldRejectUnknownBulletMarker() {
    assertThatThrownBy(() -> new MarkupCodec('#'))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Bullet marker");
  }

  @Test
  void toMarkup_shouldRenderEmptyDocumentAsEmptyString() {
    assertThat(codec.toMarkup(new BlockTree())).isEmpty();
  }

  @Test
  void toMarkup_shouldRenderHeadingsAndFormattedRuns() {
    BlockTree tree = new BlockTree();
    tree.createBlock(
        BlockType.HEADING,
        tree.rootId(),
        -1,
        List.of(TextRun.plain("Title")),
        new BlockPayload.Heading(2));
    tree.createBlock(
        BlockType.PARAGRAPH,
        tree.rootId(),
        -1,
        List.of(
            TextRun.plain("Plain "),
            TextRun.of("bold", TextFormat.BOLD),
            TextRun.plain(" and "),
            TextRun.of("it", TextFormat.ITALIC),
            TextRun.plain(" "),
            TextRun.of("gone", TextFormat.STRIKETHROUGH),
            TextRun.plain(" "),
            TextRun.of("x = 1", TextFormat.CODE)),
        null);

    assertThat(codec.toMarkup(tree))
        .isEqualTo("## Title\n\nPlain **bold** and *it* ~~gone~~ `x = 1`\n");
  }

  @Test
  void toMarkup_shouldMoveWhitespaceOutsideDelimiters() {
    BlockTree tree = new BlockTree();
    tree.createBlock(
        BlockType.PARAGRAPH,
        tree.rootId(),
        -1,
        List.of(TextRun.plain("a"), TextRun.of(" b ", TextFormat.BOLD), TextRun.plain("c")),
        null);

    assertThat(codec.toMarkup(tree)).isEqualTo("a **b** c\n");
  }

  @Test
  void toMarkup_shouldNormalizeBulletMarkers() {
    BlockTree tree = new BlockTree();
    Block first =
        tree.createBlock(
            BlockType.LIST_ITEM,
            tree.rootId(),
            -1,
            List.of(TextRun.plain("one")),
            new BlockPayload.ListItem(BlockPayload.ListStyle.BULLET, '*'));
    tree.createBlock(
        BlockType.LIST_ITEM,
        first.id(),
        -1,
        List.of(TextRun.plain("two")),
        new BlockPayload.ListItem(BlockPayload.ListStyle.BULLET, '+'));
    tree.createBlock(
        BlockType.LIST_ITEM,
        tree.rootId(),
        -1,
        List.of(TextRun.plain("three")),
        BlockPayload.ListItem.bullet());

    assertThat(codec.toMarkup(tree)).isEqualTo("- one\n  - two\n- three\n");
    assertThat(new MarkupCodec('*').toMarkup(tree)).isEqualTo("* one\n  * two\n* three\n");
  }

  @Test
  void toMarkup_shouldNumberOrderedItems() {
    BlockTree tree = new BlockTree();
    for (String text : List.of("alpha", "beta")) {
      tree.createBlock(
          BlockType.LIST_ITEM,
          tree.rootId(),
          -1,
          List.of(TextRun.plain(text)),
          new BlockPayload.ListItem(BlockPayload.ListStyle.ORDERED, ')'));
    }

    assertThat(codec.toMarkup(tree)).isEqualTo("1) alpha\n2) beta\n");
  }

  @Test
  void toMarkup_shouldEscapeBlockSyntaxInText() {
    BlockTree tree = new BlockTree();
    tree.createBlock(
        BlockType.PARAGRAPH,
        tree.rootId(),
        -1,
        List.of(TextRun.plain("# not a heading *x*\n1. not a list")),
        null);

    assertThat(codec.toMarkup(tree)).isEqualTo("\\# not a heading \\*x\\*\n1\\. not a list\n");
  }

  @Test
  void toMarkup_shouldKeepIndentedMarkerCharactersInParagraphText() {
    BlockTree tree = new BlockTree();
    tree.createBlock(
        BlockType.PARAGRAPH,
        tree.rootId(),
        -1,
        List.of(TextRun.plain("total\n    + 3 more\n\t- gone")),
        null);

    String markup = codec.toMarkup(tree);

    assertThat(markup).isEqualTo("total\n    \\+ 3 more\n\t\\- gone\n");
    assertThat(codec.fromMarkup(markup).blocksInOrder())
        .filteredOn(block -> block.type() == BlockType.PARAGRAPH)
        .singleElement()
        .satisfies(block -> assertThat(block.plainText()).contains("+ 3 more").contains("- gone"));
  }

  @Test
  void toMarkup_shouldLengthenFenceAroundBackticks() {
    BlockTree tree = new BlockTree();
    tree.createBlock(
        BlockType.CODE,
        tree.rootId(),
        -1,
        List.of(TextRun.plain("a ``` b")),
        new BlockPayload.Code("java"));

    assertThat(codec.toMarkup(tree)).isEqualTo("````java\na ``` b\n````\n");
  }

  @Test
  void toMarkup_shouldRenderQuoteWithParagraphs() {
    BlockTree tree = new BlockTree();
    Block quote =
        tree.createBlock(BlockType.QUOTE, tree.rootId(), -1, List.of(TextRun.plain("said")), null);
    tree.createBlock(BlockType.PARAGRAPH, quote.id(), -1, List.of(TextRun.plain("more")), null);

    assertThat(codec.toMarkup(tree)).isEqualTo("> said\n>\n> more\n");
  }

  @Test
  void toMarkup_shouldWriteStandInsForReferenceKinds() {
    BlockTree tree = new BlockTree();
    Block paragraph =
        tree.createBlock(
            BlockType.PARAGRAPH, tree.rootId(), -1, List.of(TextRun.plain("See")), null);
    tree.createBlock(
        BlockType.AUDIO_BLOCK,
        paragraph.id(),
        -1,
        List.of(),
        new BlockPayload.Audio("rec-1", "rec-1.wav", 65_000, null));
    tree.createBlock(
        BlockType.BLOCK_REFERENCE,
        paragraph.id(),
        -1,
        List.of(),
        new BlockPayload.Reference("blk-1", "note-1", "earlier point"));
    tree.createBlock(
        BlockType.BACKLINK,
        paragraph.id(),
        -1,
        List.of(),
        new BlockPayload.Backlink("note-2", "Week 2"));

    assertThat(codec.toMarkup(tree))
        .isEqualTo("See [audio rec-1@01:05] ((earlier point)) [[Week 2]]\n");
  }

  @Test
  void fromMarkup_shouldNotRecreateStandIns() {
    BlockTree tree = codec.fromMarkup("See [audio rec-1@01:05] ((earlier point)) [[Week 2]]\n");

    assertThat(tree.blocksInOrder())
        .extracting(Block::type)
        .containsExactly(BlockType.ROOT, BlockType.PARAGRAPH);
    Block paragraph = tree.getChildren(tree.rootId()).get(0);
    assertThat(paragraph.plainText())
        .isEqualTo("See [audio rec-1@01:05] ((earlier point)) [[Week 2]]");
  }

  @Test
  void fromMarkup_shouldReturnRootOnlyTreeForBlankInput() {
    assertThat(codec.fromMarkup("  \n").size()).isEqualTo(1);
    assertThat(codec.fromMarkup(null).size()).isEqualTo(1);
  }

  @Test
  void fromMarkup_shouldMapInlineFormats() {
    BlockTree tree =
        codec.fromMarkup("# Title\n\nSome *em* and **strong** and ~~gone~~ and `code`\n");

    List<Block> blocks = tree.getChildren(tree.rootId());
    assertThat(blocks)
        .extracting(Block::type)
        .containsExactly(BlockType.HEADING, BlockType.PARAGRAPH);
    assertThat(blocks.get(0).payloadAs(BlockPayload.Heading.class).level()).isEqualTo(1);
    assertThat(blocks.get(1).text())
        .containsExactly(
            TextRun.plain("Some "),
            TextRun.of("em", TextFormat.ITALIC),
            TextRun.plain(" and "),
            TextRun.of("strong", TextFormat.BOLD),
            TextRun.plain(" and "),
            TextRun.of("gone", TextFormat.STRIKETHROUGH),
            TextRun.plain(" and "),
            TextRun.of("code", TextFormat.CODE));
  }

  @Test
  void fromMarkup_shouldBuildNestedLists() {
    BlockTree tree = codec.fromMarkup("* a\n  1) b\n* c\n");

    List<Block> top = tree.getChildren(tree.rootId());
    assertThat(top).extracting(Block::plainText).containsExactly("a", "c");
    assertThat(top.get(0).payloadAs(BlockPayload.ListItem.class))
        .isEqualTo(new BlockPayload.ListItem(BlockPayload.ListStyle.BULLET, '*'));

    List<Block> nested = tree.getChildren(top.get(0).id());
    assertThat(nested).extracting(Block::plainText).containsExactly("b");
    assertThat(nested.get(0).payloadAs(BlockPayload.ListItem.class))
        .isEqualTo(new BlockPayload.ListItem(BlockPayload.ListStyle.ORDERED, ')'));
  }

  @Test
  void fromMarkup_shouldKeepLinksAsChildren() {
    BlockTree tree = codec.fromMarkup("Read [the docs](https://example.com/docs)\n");

    Block paragraph = tree.getChildren(tree.rootId()).get(0);
    assertThat(paragraph.plainText()).isEqualTo("Read");
    Block link = tree.getChildren(paragraph.id()).get(0);
    assertThat(link.type()).isEqualTo(BlockType.LINK);
    assertThat(link.plainText()).isEqualTo("the docs");
    assertThat(link.payloadAs(BlockPayload.Link.class).url())
        .isEqualTo("https://example.com/docs");
  }

  @Test
  void fromMarkup_shouldReadCodeAndQuotes() {
    BlockTree tree = codec.fromMarkup("```python extra\nprint(1)\n```\n\n> first\n>\n> second\n");

    List<Block> top = tree.getChildren(tree.rootId());
    assertThat(top).extracting(Block::type).containsExactly(BlockType.CODE, BlockType.QUOTE);
    assertThat(top.get(0).plainText()).isEqualTo("print(1)");
    assertThat(top.get(0).payloadAs(BlockPayload.Code.class).language()).isEqualTo("python");
    assertThat(top.get(1).plainText()).isEqualTo("first");
    assertThat(tree.getChildren(top.get(1).id()))
        .extracting(Block::plainText)
        .containsExactly("second");
  }

  @Test
  void toMarkup_shouldBeStableAcrossImport() {
    String markup =
        "# Notes\n\n"
            + "Intro with **bold** and *italics* plus \\*stars\\*\n\n"
            + "- one\n  - nested\n- two\n\n"
            + "Between lists\n\n"
            + "1. first\n2. second\n\n"
            + "> quoted\n>\n> more\n\n"
            + "```java\nint x = 1;\n```\n\n"
            + "Read [docs](https://example.com/docs)\n";

    BlockTree imported = codec.fromMarkup(markup);

    assertThat(codec.toMarkup(imported)).isEqualTo(markup);
  }

  @Test
  void normalizeBulletMarkers_shouldSkipFencedCode() {
    String markup = "* a\n```\n* keep\n```\n+ b\n";

    assertThat(codec.normalizeBulletMarkers(markup)).isEqualTo("- a\n```\n* keep\n```\n- b\n");
  }
}
