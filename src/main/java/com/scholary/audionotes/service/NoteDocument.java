package com.scholary.audionotes.service;

import com.scholary.audionotes.block.BlockTree;

/**
 * An open note: its tree and the handle that stops auto-tagging it.
 *
 * @param noteId the note id
 * @param tree the live document
 * @param detachTagger stops the auto-tagger listening to {@code tree}
 */
public record NoteDocument(String noteId, BlockTree tree, Runnable detachTagger) {}
