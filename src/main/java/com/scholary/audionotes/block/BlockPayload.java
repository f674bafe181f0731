package com.scholary.audionotes.block;

/**
 * Kind-specific data attached to a block.
 *
 * <p>{@link BlockType#payloadType()} names the variant each kind must carry. Payloads are
 * immutable; updating one means building a new value and handing it to {@link
 * BlockTree#updatePayload}.
 */
public interface BlockPayload {

  /** Heading level, 1 to 6. */
  record Heading(int level) implements BlockPayload {
    public Heading {
      if (level < 1 || level > 6) {
        throw new IllegalArgumentException("Heading level must be between 1 and 6");
      }
    }
  }

  /**
   * List membership of a list item.
   *
   * <p>{@code marker} is the bullet character the item was authored with. Markup export
   * normalizes it, so it only matters for lossless snapshots.
   */
  record ListItem(ListStyle style, char marker) implements BlockPayload {
    public ListItem {
      if (style == null) {
        throw new IllegalArgumentException("List style cannot be null");
      }
    }

    public static ListItem bullet() {
      return new ListItem(ListStyle.BULLET, '-');
    }

    public static ListItem ordered() {
      return new ListItem(ListStyle.ORDERED, '.');
    }
  }

  enum ListStyle {
    BULLET,
    ORDERED
  }

  /** Fenced code block; language may be null. */
  record Code(String language) implements BlockPayload {}

  record Link(String url) implements BlockPayload {
    public Link {
      if (url == null || url.isBlank()) {
        throw new IllegalArgumentException("Link url cannot be blank");
      }
    }
  }

  /**
   * Playable slice of a recording.
   *
   * <p>{@code endOffsetMs} is null for clips that run to the end of the file.
   */
  record Audio(String recordingId, String filePath, long startOffsetMs, Long endOffsetMs)
      implements BlockPayload {
    public Audio {
      if (recordingId == null || recordingId.isBlank()) {
        throw new IllegalArgumentException("Audio recordingId cannot be blank");
      }
      if (filePath == null || filePath.isBlank()) {
        throw new IllegalArgumentException("Audio filePath cannot be blank");
      }
      if (startOffsetMs < 0) {
        throw new IllegalArgumentException("Audio start offset cannot be negative");
      }
      if (endOffsetMs != null && endOffsetMs <= startOffsetMs) {
        throw new IllegalArgumentException("Audio end offset must be after start offset");
      }
    }

    public Audio withStartOffsetMs(long newStartOffsetMs) {
      return new Audio(recordingId, filePath, newStartOffsetMs, endOffsetMs);
    }

    public Audio withEndOffsetMs(Long newEndOffsetMs) {
      return new Audio(recordingId, filePath, startOffsetMs, newEndOffsetMs);
    }
  }

  /** Embedded reference to a block, possibly in another note. */
  record Reference(String targetBlockId, String targetNoteId, String previewText)
      implements BlockPayload {
    public Reference {
      if (targetBlockId == null || targetBlockId.isBlank()) {
        throw new IllegalArgumentException("Reference targetBlockId cannot be blank");
      }
      if (targetNoteId == null || targetNoteId.isBlank()) {
        throw new IllegalArgumentException("Reference targetNoteId cannot be blank");
      }
      previewText = previewText == null ? "" : previewText;
    }
  }

  record Backlink(String targetNoteId, String targetTitle) implements BlockPayload {
    public Backlink {
      if (targetNoteId == null || targetNoteId.isBlank()) {
        throw new IllegalArgumentException("Backlink targetNoteId cannot be blank");
      }
      targetTitle = targetTitle == null ? "" : targetTitle;
    }
  }
}
