package com.scholary.audionotes.api;

import com.scholary.audionotes.block.TextRun;
import java.util.List;

/**
 * Partial update of a block. Null fields are left unchanged.
 *
 * @param text replacement plain text
 * @param parentId new parent; with only {@code index} set the block moves within its parent
 * @param index new position among the parent's children; negative appends
 */
public record BlockUpdateRequest(String text, String parentId, Integer index) {

  List<TextRun> runs() {
    if (text == null) {
      return null;
    }
    return text.isEmpty() ? List.of() : List.of(TextRun.plain(text));
  }
}
