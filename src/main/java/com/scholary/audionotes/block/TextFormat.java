package com.scholary.audionotes.block;

/** Inline format flags a text run can carry. */
public enum TextFormat {
  BOLD,
  ITALIC,
  CODE,
  STRIKETHROUGH,
  UNDERLINE
}
