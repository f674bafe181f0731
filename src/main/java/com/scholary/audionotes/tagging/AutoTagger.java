package com.scholary.audionotes.tagging;

import com.scholary.audionotes.block.Block;
import com.scholary.audionotes.block.BlockTree;
import com.scholary.audionotes.block.BlockType;
import com.scholary.audionotes.block.MutationEvent;
import com.scholary.audionotes.logging.StructuredLogger;
import com.scholary.audionotes.recording.RecordingSession;
import com.scholary.audionotes.recording.RecordingStatus;
import com.scholary.audionotes.reference.AudioReference;
import com.scholary.audionotes.reference.AudioReferenceStore;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Links newly written blocks to the moment they were written in the active recording.
 *
 * <p>The tagger listens to block trees. For every created paragraph, heading or list item it
 * reads the session offset at the moment the event is processed and stores an {@link
 * AudioReference}. Each block is tagged at most once per recording: the id is marked processed
 * before the asynchronous write is queued, so a repeated or re-delivered event never produces a
 * second reference. The processed set is cleared whenever a different recording becomes active.
 *
 * <p>Blocks that already hold an audio block were placed against a recording by hand and are
 * left alone.
 */
@Component
public class AutoTagger {

  private static final Logger LOGGER = LoggerFactory.getLogger(AutoTagger.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final RecordingSession session;
  private final AudioReferenceStore store;
  private final Executor executor;

  private final Set<String> processed = new HashSet<>();
  private String processedRecordingId;

  public AutoTagger(
      RecordingSession session,
      AudioReferenceStore store,
      @Qualifier("taskExecutor") Executor executor) {
    this.session = session;
    this.store = store;
    this.executor = executor;
  }

  /**
   * Start tagging blocks created in a tree.
   *
   * @return call to stop tagging this tree
   */
  public Runnable attach(BlockTree tree) {
    return tree.addListener(this::onMutations);
  }

  /** Number of blocks handled for the current recording. */
  public synchronized int processedCount() {
    return processed.size();
  }

  static boolean isTaggable(BlockType type) {
    return switch (type) {
      case PARAGRAPH, HEADING, LIST_ITEM -> true;
      case ROOT, QUOTE, CODE, LINK, AUDIO_BLOCK, BLOCK_REFERENCE, BACKLINK -> false;
    };
  }

  void onMutations(BlockTree tree, List<MutationEvent> events) {
    for (MutationEvent event : events) {
      if (event.type() != MutationEvent.Type.CREATED) {
        continue;
      }
      Optional<Block> block = tree.find(event.blockId());
      if (block.isPresent() && isTaggable(block.get().type())) {
        tag(tree, block.get());
      }
    }
  }

  private synchronized void tag(BlockTree tree, Block block) {
    RecordingSession.SessionSnapshot snapshot = session.snapshot();
    if (snapshot.status() == RecordingStatus.IDLE) {
      return;
    }

    if (!snapshot.recordingId().equals(processedRecordingId)) {
      LOGGER.debug(
          "Recording changed, resetting processed blocks: previous={}, current={}, cleared={}",
          processedRecordingId,
          snapshot.recordingId(),
          processed.size());
      processed.clear();
      processedRecordingId = snapshot.recordingId();
    }

    if (processed.contains(block.id())) {
      return;
    }
    if (hasAudioChild(tree, block)) {
      processed.add(block.id());
      LOGGER.debug("Block already holds audio, not tagging: blockId={}", block.id());
      return;
    }

    AudioReference reference =
        AudioReference.at(snapshot.recordingId(), block.id(), snapshot.offsetMs());
    processed.add(block.id());

    try {
      executor.execute(() -> write(reference, snapshot.noteId()));
    } catch (RejectedExecutionException e) {
      STRUCTURED_LOGGER.logReferenceWriteFailed(reference.recordingId(), reference.blockId(), e);
    }
  }

  private void write(AudioReference reference, String noteId) {
    StructuredLogger.setRecordingContext(reference.recordingId(), noteId);
    try {
      if (store.putAudioReference(reference)) {
        STRUCTURED_LOGGER.logBlockTagged(
            reference.recordingId(), reference.blockId(), reference.offsetMs());
      }
    } catch (RuntimeException e) {
      STRUCTURED_LOGGER.logReferenceWriteFailed(reference.recordingId(), reference.blockId(), e);
    } finally {
      StructuredLogger.clearRecordingContext();
    }
  }

  private static boolean hasAudioChild(BlockTree tree, Block block) {
    return tree.getChildren(block.id()).stream()
        .anyMatch(child -> child.type() == BlockType.AUDIO_BLOCK);
  }
}
