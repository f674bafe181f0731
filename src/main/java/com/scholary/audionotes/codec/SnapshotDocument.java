package com.scholary.audionotes.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Wire layout of a persisted document.
 *
 * <p>Blocks are listed flat, in depth-first pre-order, and reference their children by id. Each
 * block carries the version of its kind's layout; fields a newer writer adds are ignored on read.
 *
 * <pre>
 * {
 *   "formatVersion": 1,
 *   "rootId": "r1",
 *   "blocks": [
 *     {"id": "r1", "type": "root", "version": 1, "children": ["p1"]},
 *     {"id": "p1", "type": "paragraph", "version": 1,
 *      "text": [{"text": "Hello", "format": ["bold"]}]}
 *   ]
 * }
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
record SnapshotDocument(Integer formatVersion, String rootId, List<Block> blocks) {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record Block(
      String id,
      String type,
      Integer version,
      List<String> children,
      List<Run> text,
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
      String targetTitle) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  record Run(String text, List<String> format) {}
}
