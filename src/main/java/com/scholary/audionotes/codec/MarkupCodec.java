package com.scholary.audionotes.codec;

import com.scholary.audionotes.block.Block;
import com.scholary.audionotes.block.BlockPayload;
import com.scholary.audionotes.block.BlockTree;
import com.scholary.audionotes.block.BlockType;
import com.scholary.audionotes.block.TextFormat;
import com.scholary.audionotes.block.TextRun;
import com.scholary.audionotes.config.AudioNotesProperties;
import com.scholary.audionotes.playback.PlaybackTimes;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Markdown import and export for block trees.
 *
 * <p>Markup is the interchange layout, not the persisted one. Export writes every kind, but audio
 * blocks, block references and backlinks only as reference-only stand-ins ({@code [audio
 * rec@01:05]}, {@code ((preview))}, {@code [[Title]]}). Import never turns those stand-ins back
 * into blocks: they come back as plain text, so a markup round trip of a document holding them is
 * not identity-preserving.
 *
 * <p>Bullet items are written with whatever marker they carry and then normalized to the
 * configured marker in a single pass over the rendered text.
 */
@Component
public class MarkupCodec {

  private static final Pattern BULLET_LINE = Pattern.compile("^(\\s*)[-*+] ");
  private static final Pattern FENCE_OPEN = Pattern.compile("^(`{3,})");
  private static final Pattern ORDERED_START = Pattern.compile("^(\\d{1,9})([.)])");
  private static final String ESCAPED_CHARS = "\\*_[]~`<&";

  private final char bulletMarker;
  private final MarkupImporter importer = new MarkupImporter();

  @Autowired
  public MarkupCodec(AudioNotesProperties properties) {
    this(properties.markup().bulletChar());
  }

  public MarkupCodec(char bulletMarker) {
    if (bulletMarker != '-' && bulletMarker != '*' && bulletMarker != '+') {
      throw new IllegalArgumentException("Bullet marker must be one of - * +");
    }
    this.bulletMarker = bulletMarker;
  }

  /**
   * Render a tree as Markdown.
   *
   * @param tree the document to export
   * @return Markdown text, ending with a newline unless the document is empty
   */
  public String toMarkup(BlockTree tree) {
    List<String> chunks = new ArrayList<>();
    List<Block> topLevel = tree.getChildren(tree.rootId());

    int i = 0;
    while (i < topLevel.size()) {
      Block block = topLevel.get(i);
      if (block.type() == BlockType.LIST_ITEM) {
        // consecutive top-level items form one list
        int end = i;
        while (end < topLevel.size() && topLevel.get(end).type() == BlockType.LIST_ITEM) {
          end++;
        }
        StringBuilder list = new StringBuilder();
        renderListItems(tree, topLevel.subList(i, end), "", list);
        chunks.add(list.substring(0, list.length() - 1));
        i = end;
      } else {
        String rendered = renderBlock(tree, block);
        if (!rendered.isEmpty()) {
          chunks.add(rendered);
        }
        i++;
      }
    }

    if (chunks.isEmpty()) {
      return "";
    }
    return normalizeBulletMarkers(String.join("\n\n", chunks) + "\n");
  }

  public BlockTree fromMarkup(String markup) {
    return fromMarkup(markup, () -> UUID.randomUUID().toString());
  }

  /**
   * Parse Markdown into a fresh tree.
   *
   * @param markup Markdown text; null or blank yields a tree holding only the root
   * @param idGenerator id source for the created blocks
   */
  public BlockTree fromMarkup(String markup, Supplier<String> idGenerator) {
    return importer.importMarkup(markup, idGenerator);
  }

  /** Rewrite every bullet marker outside fenced code to the configured one. */
  String normalizeBulletMarkers(String markup) {
    String replacement = Matcher.quoteReplacement(String.valueOf(bulletMarker)) + " ";
    String[] lines = markup.split("\n", -1);
    StringBuilder out = new StringBuilder(markup.length());
    int openFence = 0;

    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      if (openFence > 0) {
        if (isClosingFence(line, openFence)) {
          openFence = 0;
        }
      } else {
        Matcher fence = FENCE_OPEN.matcher(line);
        if (fence.find()) {
          openFence = fence.group(1).length();
        } else {
          line = BULLET_LINE.matcher(line).replaceFirst("$1" + replacement);
        }
      }
      out.append(line);
      if (i < lines.length - 1) {
        out.append('\n');
      }
    }
    return out.toString();
  }

  // ---- blocks ----

  private String renderBlock(BlockTree tree, Block block) {
    return switch (block.type()) {
      case PARAGRAPH -> escapeLineStarts(inlineContent(tree, block));
      case HEADING -> renderHeading(tree, block);
      case LIST_ITEM -> {
        StringBuilder list = new StringBuilder();
        renderListItems(tree, List.of(block), "", list);
        yield list.substring(0, list.length() - 1);
      }
      case QUOTE -> renderQuote(tree, block);
      case CODE -> renderCode(block);
      case LINK, AUDIO_BLOCK, BLOCK_REFERENCE, BACKLINK -> renderInline(block);
      case ROOT -> throw new IllegalStateException("The root block is never rendered directly");
    };
  }

  private String renderHeading(BlockTree tree, Block block) {
    int level = block.payloadAs(BlockPayload.Heading.class).level();
    String content = inlineContent(tree, block).replace('\n', ' ');
    if (content.endsWith("#")) {
      // a trailing # run would be read as a closing sequence
      content = content.substring(0, content.length() - 1) + "\\#";
    }
    return "#".repeat(level) + " " + content;
  }

  private void renderListItems(
      BlockTree tree, List<Block> items, String indent, StringBuilder out) {
    BlockPayload.ListStyle currentStyle = null;
    int number = 0;

    for (Block item : items) {
      BlockPayload.ListItem payload = item.payloadAs(BlockPayload.ListItem.class);
      if (payload.style() != currentStyle) {
        currentStyle = payload.style();
        number = 0;
      }

      String prefix =
          switch (payload.style()) {
            case BULLET -> (isBulletChar(payload.marker()) ? payload.marker() : '-') + " ";
            case ORDERED ->
                ++number + (payload.marker() == ')' ? ")" : ".") + " ";
          };
      String childIndent = indent + " ".repeat(prefix.length());

      String[] lines = escapeLineStarts(inlineContent(tree, item)).split("\n", -1);
      out.append(indent).append(prefix).append(lines[0]).append('\n');
      for (int i = 1; i < lines.length; i++) {
        out.append(childIndent).append(lines[i]).append('\n');
      }

      List<Block> nested =
          tree.getChildren(item.id()).stream()
              .filter(child -> child.type() == BlockType.LIST_ITEM)
              .toList();
      renderListItems(tree, nested, childIndent, out);
    }
  }

  private String renderQuote(BlockTree tree, Block block) {
    List<String> paragraphs = new ArrayList<>();
    String own = inlineContent(tree, block);
    if (!own.isEmpty()) {
      paragraphs.add(escapeLineStarts(own));
    }
    for (Block child : tree.getChildren(block.id())) {
      if (child.type() == BlockType.PARAGRAPH) {
        paragraphs.add(escapeLineStarts(inlineContent(tree, child)));
      }
    }
    if (paragraphs.isEmpty()) {
      return "";
    }

    StringBuilder out = new StringBuilder();
    String[] lines = String.join("\n\n", paragraphs).split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      out.append(lines[i].isEmpty() ? ">" : "> " + lines[i]);
      if (i < lines.length - 1) {
        out.append('\n');
      }
    }
    return out.toString();
  }

  private String renderCode(Block block) {
    String content = block.plainText();
    String language = block.payloadAs(BlockPayload.Code.class).language();
    String fence = "`".repeat(Math.max(3, longestBacktickRun(content) + 1));
    StringBuilder out = new StringBuilder();
    out.append(fence).append(language == null ? "" : language).append('\n');
    if (!content.isEmpty()) {
      out.append(content).append('\n');
    }
    return out.append(fence).toString();
  }

  // ---- inline ----

  /** A text block's own runs followed by its inline children. */
  private String inlineContent(BlockTree tree, Block block) {
    StringBuilder out = new StringBuilder(renderRuns(block.text()));
    for (Block child : tree.getChildren(block.id())) {
      if (!child.type().isInline()) {
        continue;
      }
      if (out.length() > 0 && !Character.isWhitespace(out.charAt(out.length() - 1))) {
        out.append(' ');
      }
      out.append(renderInline(child));
    }
    return out.toString();
  }

  private String renderInline(Block block) {
    return switch (block.type()) {
      case LINK -> {
        String url = block.payloadAs(BlockPayload.Link.class).url();
        String label = renderRuns(block.text());
        yield "[" + (label.isEmpty() ? escapeText(url) : label) + "](" + linkDestination(url) + ")";
      }
      case AUDIO_BLOCK -> {
        BlockPayload.Audio audio = block.payloadAs(BlockPayload.Audio.class);
        yield "[audio "
            + escapeText(audio.recordingId())
            + "@"
            + PlaybackTimes.format(audio.startOffsetMs())
            + "]";
      }
      case BLOCK_REFERENCE ->
          "((" + escapeText(block.payloadAs(BlockPayload.Reference.class).previewText()) + "))";
      case BACKLINK ->
          "[[" + escapeText(block.payloadAs(BlockPayload.Backlink.class).targetTitle()) + "]]";
      case ROOT, PARAGRAPH, HEADING, LIST_ITEM, QUOTE, CODE -> "";
    };
  }

  private String renderRuns(List<TextRun> runs) {
    StringBuilder out = new StringBuilder();
    for (TextRun run : mergeAdjacent(runs)) {
      out.append(renderRun(run));
    }
    return out.toString();
  }

  private String renderRun(TextRun run) {
    String text = run.text();
    boolean code = run.has(TextFormat.CODE);
    boolean decorated =
        code
            || run.has(TextFormat.BOLD)
            || run.has(TextFormat.ITALIC)
            || run.has(TextFormat.STRIKETHROUGH);
    if (!decorated) {
      return escapeText(text);
    }

    int start = 0;
    int end = text.length();
    while (start < end && Character.isWhitespace(text.charAt(start))) {
      start++;
    }
    while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
      end--;
    }
    if (start == end) {
      return text;
    }

    String core = text.substring(start, end);
    String body = code ? codeSpan(core) : escapeText(core);
    if (run.has(TextFormat.STRIKETHROUGH)) {
      body = "~~" + body + "~~";
    }
    if (run.has(TextFormat.ITALIC)) {
      body = "*" + body + "*";
    }
    if (run.has(TextFormat.BOLD)) {
      body = "**" + body + "**";
    }
    return text.substring(0, start) + body + text.substring(end);
  }

  private static List<TextRun> mergeAdjacent(List<TextRun> runs) {
    List<TextRun> merged = new ArrayList<>(runs.size());
    for (TextRun run : runs) {
      if (run.text().isEmpty()) {
        continue;
      }
      int last = merged.size() - 1;
      if (last >= 0 && merged.get(last).formats().equals(run.formats())) {
        TextRun previous = merged.get(last);
        merged.set(last, new TextRun(previous.text() + run.text(), run.formats()));
      } else {
        merged.add(run);
      }
    }
    return merged;
  }

  private static String codeSpan(String text) {
    String ticks = "`".repeat(longestBacktickRun(text) + 1);
    boolean pad =
        text.startsWith("`")
            || text.endsWith("`")
            || (text.startsWith(" ") && text.endsWith(" ") && !text.isBlank());
    return pad ? ticks + " " + text + " " + ticks : ticks + text + ticks;
  }

  private static String linkDestination(String url) {
    boolean needsBrackets = url.chars().anyMatch(c -> c == ' ' || c == '(' || c == ')');
    return needsBrackets ? "<" + url.replace("<", "%3C").replace(">", "%3E") + ">" : url;
  }

  // ---- escaping ----

  static String escapeText(String text) {
    StringBuilder out = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (ESCAPED_CHARS.indexOf(c) >= 0) {
        out.append('\\');
      }
      out.append(c);
    }
    return out.toString();
  }

  /** Escape characters that would open a block construct at the start of a line. */
  static String escapeLineStarts(String content) {
    String[] lines = content.split("\n", -1);
    StringBuilder out = new StringBuilder(content.length() + 4);
    for (int i = 0; i < lines.length; i++) {
      out.append(escapeLineStart(lines[i]));
      if (i < lines.length - 1) {
        out.append('\n');
      }
    }
    return out.toString();
  }

  private static String escapeLineStart(String line) {
    int indent = 0;
    // any indent: the bullet rewrite matches markers at every depth
    while (indent < line.length() && isIndent(line.charAt(indent))) {
      indent++;
    }
    String head = line.substring(0, indent);
    String rest = line.substring(indent);
    if (rest.isEmpty()) {
      return line;
    }

    char first = rest.charAt(0);
    if (first == '#' || first == '>' || first == '-' || first == '+' || first == '=') {
      return head + "\\" + rest;
    }
    Matcher ordered = ORDERED_START.matcher(rest);
    if (ordered.find()) {
      return head + ordered.group(1) + "\\" + rest.substring(ordered.group(1).length());
    }
    return line;
  }

  private static boolean isClosingFence(String line, int openLength) {
    String trimmed = line.strip();
    return trimmed.length() >= openLength && trimmed.chars().allMatch(c -> c == '`');
  }

  private static boolean isIndent(char c) {
    return c == ' ' || c == '\t';
  }

  private static boolean isBulletChar(char c) {
    return c == '-' || c == '*' || c == '+';
  }

  private static int longestBacktickRun(String text) {
    int longest = 0;
    int current = 0;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '`') {
        current++;
        longest = Math.max(longest, current);
      } else {
        current = 0;
      }
    }
    return longest;
  }
}
