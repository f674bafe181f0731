package com.scholary.audionotes.service;

import com.scholary.audionotes.block.Block;
import com.scholary.audionotes.block.BlockPayload;
import com.scholary.audionotes.block.BlockTree;
import com.scholary.audionotes.block.BlockType;
import com.scholary.audionotes.block.TextRun;
import com.scholary.audionotes.codec.MarkupCodec;
import com.scholary.audionotes.codec.SnapshotCodec;
import com.scholary.audionotes.reference.SnapshotStore;
import com.scholary.audionotes.tagging.AutoTagger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeps note documents open and moves them between their live, persisted and interchange forms.
 *
 * <p>Every open document has the auto-tagger attached, so blocks created through {@link
 * #createBlock} while a recording runs get tagged. Imported documents replace the open one
 * wholesale; the tagger is attached after the import, so imported blocks are never tagged.
 */
@Service
public class NoteDocumentService {

  private static final Logger LOGGER = LoggerFactory.getLogger(NoteDocumentService.class);

  private final SnapshotStore snapshotStore;
  private final SnapshotCodec snapshotCodec;
  private final MarkupCodec markupCodec;
  private final AutoTagger autoTagger;

  private final Map<String, NoteDocument> open = new HashMap<>();

  public NoteDocumentService(
      SnapshotStore snapshotStore,
      SnapshotCodec snapshotCodec,
      MarkupCodec markupCodec,
      AutoTagger autoTagger) {
    this.snapshotStore = snapshotStore;
    this.snapshotCodec = snapshotCodec;
    this.markupCodec = markupCodec;
    this.autoTagger = autoTagger;
  }

  /**
   * Open a note for editing, starting an empty document if it was never saved.
   *
   * @throws com.scholary.audionotes.codec.DecodeException if the stored snapshot is corrupt
   */
  public synchronized NoteDocument open(String noteId) {
    NoteDocument document = open.get(noteId);
    if (document != null) {
      return document;
    }
    BlockTree tree =
        snapshotStore
            .loadSnapshot(noteId)
            .map(snapshotCodec::fromSnapshot)
            .orElseGet(BlockTree::new);
    LOGGER.info("Opened note: noteId={}, blocks={}", noteId, tree.size());
    return attach(noteId, tree);
  }

  /**
   * An open note, or a stored one loaded and opened.
   *
   * @throws NoteNotFoundException if the note is neither open nor stored
   */
  public synchronized NoteDocument get(String noteId) {
    NoteDocument document = open.get(noteId);
    if (document != null) {
      return document;
    }
    Optional<byte[]> snapshot = snapshotStore.loadSnapshot(noteId);
    if (snapshot.isEmpty()) {
      throw new NoteNotFoundException("Note not found: " + noteId);
    }
    BlockTree tree = snapshotCodec.fromSnapshot(snapshot.get());
    LOGGER.info("Opened note: noteId={}, blocks={}", noteId, tree.size());
    return attach(noteId, tree);
  }

  public synchronized boolean isOpen(String noteId) {
    return open.containsKey(noteId);
  }

  /** Persist the open document of a note. */
  public synchronized void save(String noteId) {
    NoteDocument document = get(noteId);
    byte[] snapshot = snapshotCodec.toSnapshot(document.tree());
    snapshotStore.saveSnapshot(noteId, snapshot);
    LOGGER.info(
        "Saved note: noteId={}, blocks={}, bytes={}",
        noteId,
        document.tree().size(),
        snapshot.length);
  }

  /** Stop tagging a note and forget its open document. Unsaved edits are lost. */
  public synchronized void close(String noteId) {
    NoteDocument document = open.remove(noteId);
    if (document != null) {
      document.detachTagger().run();
      LOGGER.info("Closed note: noteId={}", noteId);
    }
  }

  /** Blocks of a note in document order, root first. */
  public synchronized List<Block> blocks(String noteId) {
    return get(noteId).tree().blocksInOrder();
  }

  /**
   * Add a block to a note, opening an empty document if the note is new.
   *
   * @param parentId parent block, or null for the root
   * @param index position among the parent's children; negative appends
   * @throws com.scholary.audionotes.block.StructuralException if the edit is invalid
   */
  public synchronized Block createBlock(
      String noteId,
      BlockType type,
      String parentId,
      int index,
      List<TextRun> text,
      BlockPayload payload) {
    BlockTree tree = open(noteId).tree();
    String parent = parentId == null ? tree.rootId() : parentId;
    List<Block> created = new ArrayList<>(1);
    tree.mutate(editor -> created.add(editor.createBlock(type, parent, index, text, payload)));
    Block block = created.get(0);
    LOGGER.debug(
        "Created block: noteId={}, blockId={}, type={}", noteId, block.id(), type.wireName());
    return block;
  }

  /**
   * Replace a block's text and/or move it, as one batch.
   *
   * @param text new runs, or null to keep the current text
   * @param newParentId new parent, or null to stay under the current one
   * @param newIndex new position, or null to stay in place unless the parent changes
   * @throws com.scholary.audionotes.block.StructuralException if the block does not exist or the
   *     edit is invalid
   */
  public synchronized Block updateBlock(
      String noteId, String blockId, List<TextRun> text, String newParentId, Integer newIndex) {
    BlockTree tree = get(noteId).tree();
    tree.get(blockId);
    boolean move = newParentId != null || newIndex != null;
    String parentId = newParentId != null ? newParentId : tree.parentOf(blockId).orElse(null);
    int index = newIndex == null ? -1 : newIndex;
    tree.mutate(
        editor -> {
          if (text != null) {
            editor.updateText(blockId, text);
          }
          if (move) {
            editor.moveBlock(blockId, parentId, index);
          }
        });
    return tree.get(blockId);
  }

  /**
   * Remove a block and its descendants.
   *
   * @throws com.scholary.audionotes.block.StructuralException if the block does not exist
   */
  public synchronized void deleteBlock(String noteId, String blockId) {
    get(noteId).tree().mutate(editor -> editor.removeBlock(blockId));
    LOGGER.debug("Removed block: noteId={}, blockId={}", noteId, blockId);
  }

  public synchronized String exportMarkup(String noteId) {
    return markupCodec.toMarkup(get(noteId).tree());
  }

  public synchronized byte[] exportSnapshot(String noteId) {
    return snapshotCodec.toSnapshot(get(noteId).tree());
  }

  /** Replace a note with a document parsed from Markdown, and save it. */
  public synchronized NoteDocument importMarkup(String noteId, String markup) {
    BlockTree tree = markupCodec.fromMarkup(markup);
    LOGGER.info("Imported markup: noteId={}, blocks={}", noteId, tree.size());
    return replace(noteId, tree);
  }

  /**
   * Replace a note with a decoded snapshot, and save it.
   *
   * @throws com.scholary.audionotes.codec.DecodeException if the snapshot is invalid; the open
   *     document is kept in that case
   */
  public synchronized NoteDocument importSnapshot(String noteId, byte[] snapshot) {
    BlockTree tree = snapshotCodec.fromSnapshot(snapshot);
    LOGGER.info("Imported snapshot: noteId={}, blocks={}", noteId, tree.size());
    return replace(noteId, tree);
  }

  private NoteDocument replace(String noteId, BlockTree tree) {
    close(noteId);
    NoteDocument document = attach(noteId, tree);
    snapshotStore.saveSnapshot(noteId, snapshotCodec.toSnapshot(tree));
    return document;
  }

  private NoteDocument attach(String noteId, BlockTree tree) {
    NoteDocument document = new NoteDocument(noteId, tree, autoTagger.attach(tree));
    open.put(noteId, document);
    return document;
  }
}
