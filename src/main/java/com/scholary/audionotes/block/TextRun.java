package com.scholary.audionotes.block;

import java.util.EnumSet;
import java.util.Set;

/**
 * A run of inline text sharing one set of format flags.
 *
 * <p>The format set is copied into an unmodifiable view, so runs are safe to share between trees.
 */
public record TextRun(String text, Set<TextFormat> formats) {

  public TextRun {
    if (text == null) {
      throw new IllegalArgumentException("Text run text cannot be null");
    }
    formats =
        formats == null || formats.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(formats));
  }

  public static TextRun plain(String text) {
    return new TextRun(text, Set.of());
  }

  public static TextRun of(String text, TextFormat first, TextFormat... rest) {
    return new TextRun(text, EnumSet.of(first, rest));
  }

  public boolean has(TextFormat format) {
    return formats.contains(format);
  }
}
