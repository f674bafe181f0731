package com.scholary.audionotes.codec;

import com.scholary.audionotes.block.Block;
import com.scholary.audionotes.block.BlockPayload;
import com.scholary.audionotes.block.BlockTree;
import com.scholary.audionotes.block.BlockType;
import com.scholary.audionotes.block.TextFormat;
import com.scholary.audionotes.block.TextRun;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import org.commonmark.ext.gfm.strikethrough.Strikethrough;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.CustomNode;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a block tree from a commonmark AST.
 *
 * <p>Links become {@code link} children of the text block they appear in; their position inside
 * the text is not kept. Constructs without a block kind (thematic breaks, lists inside quotes,
 * headings inside list items) are flattened into plain text or skipped.
 */
final class MarkupImporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(MarkupImporter.class);

  private static final Parser PARSER =
      Parser.builder().extensions(List.of(StrikethroughExtension.create())).build();

  BlockTree importMarkup(String markup, Supplier<String> idGenerator) {
    BlockTree tree = new BlockTree(idGenerator);
    if (markup == null || markup.isBlank()) {
      return tree;
    }

    Node document = PARSER.parse(markup);
    tree.mutate(editor -> appendBlocks(editor, document, editor.rootId()));
    LOGGER.debug("Imported markup: chars={}, blocks={}", markup.length(), tree.size());
    return tree;
  }

  private void appendBlocks(BlockTree.Editor editor, Node container, String parentId) {
    for (Node node = container.getFirstChild(); node != null; node = node.getNext()) {
      if (node instanceof Heading heading) {
        appendTextBlock(
            editor,
            parentId,
            BlockType.HEADING,
            new BlockPayload.Heading(heading.getLevel()),
            InlineContent.of(heading));
      } else if (node instanceof Paragraph paragraph) {
        appendTextBlock(editor, parentId, BlockType.PARAGRAPH, null, InlineContent.of(paragraph));
      } else if (node instanceof BulletList || node instanceof OrderedList) {
        appendList(editor, node, parentId);
      } else if (node instanceof BlockQuote quote) {
        appendQuote(editor, quote, parentId);
      } else if (node instanceof FencedCodeBlock fenced) {
        appendCode(editor, parentId, firstWord(fenced.getInfo()), fenced.getLiteral());
      } else if (node instanceof IndentedCodeBlock indented) {
        appendCode(editor, parentId, null, indented.getLiteral());
      } else if (node instanceof HtmlBlock html) {
        InlineContent content = new InlineContent();
        content.add(stripTrailingNewline(html.getLiteral()), Set.of());
        appendTextBlock(editor, parentId, BlockType.PARAGRAPH, null, content);
      }
    }
  }

  private void appendList(BlockTree.Editor editor, Node list, String parentId) {
    BlockPayload.ListItem payload =
        list instanceof OrderedList ordered
            ? new BlockPayload.ListItem(BlockPayload.ListStyle.ORDERED, ordered.getDelimiter())
            : new BlockPayload.ListItem(
                BlockPayload.ListStyle.BULLET, ((BulletList) list).getBulletMarker());

    for (Node item = list.getFirstChild(); item != null; item = item.getNext()) {
      if (item instanceof ListItem listItem) {
        appendListItem(editor, listItem, parentId, payload);
      }
    }
  }

  private void appendListItem(
      BlockTree.Editor editor, ListItem item, String parentId, BlockPayload.ListItem payload) {
    InlineContent content = new InlineContent();
    List<Node> nestedLists = new ArrayList<>();

    for (Node child = item.getFirstChild(); child != null; child = child.getNext()) {
      if (child instanceof BulletList || child instanceof OrderedList) {
        nestedLists.add(child);
        continue;
      }
      if (!content.isEmpty()) {
        content.add("\n", Set.of());
      }
      if (child instanceof Paragraph) {
        content.collect(child);
      } else {
        content.add(flattenText(child), Set.of());
      }
    }

    Block block = appendTextBlock(editor, parentId, BlockType.LIST_ITEM, payload, content);
    for (Node nested : nestedLists) {
      appendList(editor, nested, block.id());
    }
  }

  private void appendQuote(BlockTree.Editor editor, BlockQuote quote, String parentId) {
    Node first = quote.getFirstChild();
    InlineContent own =
        first instanceof Paragraph paragraph ? InlineContent.of(paragraph) : new InlineContent();
    Block block = appendTextBlock(editor, parentId, BlockType.QUOTE, null, own);

    Node rest = first instanceof Paragraph ? first.getNext() : first;
    for (Node child = rest; child != null; child = child.getNext()) {
      InlineContent content;
      if (child instanceof Paragraph paragraph) {
        content = InlineContent.of(paragraph);
      } else {
        content = new InlineContent();
        content.add(flattenText(child), Set.of());
      }
      appendTextBlock(editor, block.id(), BlockType.PARAGRAPH, null, content);
    }
  }

  private void appendCode(
      BlockTree.Editor editor, String parentId, String language, String literal) {
    String text = stripTrailingNewline(literal);
    List<TextRun> runs = text.isEmpty() ? List.of() : List.of(TextRun.plain(text));
    editor.createBlock(BlockType.CODE, parentId, -1, runs, new BlockPayload.Code(language));
  }

  private Block appendTextBlock(
      BlockTree.Editor editor,
      String parentId,
      BlockType type,
      BlockPayload payload,
      InlineContent content) {
    Block block = editor.createBlock(type, parentId, -1, content.runs(), payload);
    for (PendingLink link : content.links()) {
      editor.createBlock(
          BlockType.LINK, block.id(), -1, link.label(), new BlockPayload.Link(link.url()));
    }
    return block;
  }

  private static String flattenText(Node node) {
    if (node instanceof FencedCodeBlock fenced) {
      return stripTrailingNewline(fenced.getLiteral());
    }
    if (node instanceof IndentedCodeBlock indented) {
      return stripTrailingNewline(indented.getLiteral());
    }
    if (node instanceof HtmlBlock html) {
      return stripTrailingNewline(html.getLiteral());
    }
    InlineContent content = new InlineContent();
    content.collect(node);
    StringBuilder out = new StringBuilder();
    for (TextRun run : content.runs()) {
      out.append(run.text());
    }
    for (PendingLink link : content.links()) {
      out.append(' ').append(link.url());
    }
    return out.toString().strip();
  }

  private static String firstWord(String info) {
    if (info == null || info.isBlank()) {
      return null;
    }
    return info.strip().split("\\s+", 2)[0];
  }

  private static String stripTrailingNewline(String literal) {
    if (literal == null) {
      return "";
    }
    return literal.endsWith("\n") ? literal.substring(0, literal.length() - 1) : literal;
  }

  private record PendingLink(String url, List<TextRun> label) {}

  /** Inline runs of one text block plus the links pulled out of them. */
  private static final class InlineContent extends AbstractVisitor {

    private final List<TextRun> runs = new ArrayList<>();
    private final List<PendingLink> links = new ArrayList<>();
    private final Set<TextFormat> active = EnumSet.noneOf(TextFormat.class);

    static InlineContent of(Node block) {
      InlineContent content = new InlineContent();
      content.collect(block);
      return content;
    }

    void collect(Node node) {
      node.accept(this);
    }

    boolean isEmpty() {
      return runs.isEmpty() && links.isEmpty();
    }

    List<TextRun> runs() {
      if (links.isEmpty() || runs.isEmpty()) {
        return runs;
      }
      // the gap a link leaves behind is dropped along with the link
      List<TextRun> trimmed = new ArrayList<>(runs);
      TextRun last = trimmed.remove(trimmed.size() - 1);
      String text = last.text().stripTrailing();
      if (!text.isEmpty()) {
        trimmed.add(new TextRun(text, last.formats()));
      }
      return trimmed;
    }

    List<PendingLink> links() {
      return links;
    }

    void add(String text, Set<TextFormat> formats) {
      if (text == null || text.isEmpty()) {
        return;
      }
      int last = runs.size() - 1;
      if (last >= 0 && runs.get(last).formats().equals(formats)) {
        runs.set(last, new TextRun(runs.get(last).text() + text, formats));
      } else {
        runs.add(new TextRun(text, formats));
      }
    }

    @Override
    public void visit(Text text) {
      add(text.getLiteral(), active);
    }

    @Override
    public void visit(Code code) {
      Set<TextFormat> formats = EnumSet.copyOf(active);
      formats.add(TextFormat.CODE);
      add(code.getLiteral(), formats);
    }

    @Override
    public void visit(Emphasis emphasis) {
      withFormat(TextFormat.ITALIC, emphasis);
    }

    @Override
    public void visit(StrongEmphasis strongEmphasis) {
      withFormat(TextFormat.BOLD, strongEmphasis);
    }

    @Override
    public void visit(CustomNode customNode) {
      if (customNode instanceof Strikethrough) {
        withFormat(TextFormat.STRIKETHROUGH, customNode);
      } else {
        visitChildren(customNode);
      }
    }

    @Override
    public void visit(SoftLineBreak softLineBreak) {
      add("\n", active);
    }

    @Override
    public void visit(HardLineBreak hardLineBreak) {
      add("\n", active);
    }

    @Override
    public void visit(HtmlInline htmlInline) {
      add(htmlInline.getLiteral(), active);
    }

    @Override
    public void visit(Link link) {
      String destination = link.getDestination();
      if (destination == null || destination.isBlank()) {
        visitChildren(link);
        return;
      }
      InlineContent label = new InlineContent();
      label.active.addAll(active);
      label.visitChildren(link);
      links.add(new PendingLink(destination, label.runs));
    }

    private void withFormat(TextFormat format, Node node) {
      boolean added = active.add(format);
      try {
        visitChildren(node);
      } finally {
        if (added) {
          active.remove(format);
        }
      }
    }
  }
}
