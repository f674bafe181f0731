package com.scholary.audionotes.reference;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for recordings and audio references.
 *
 * <p>Nothing is evicted: references are the only link between a note and its recordings, so
 * losing one silently would break playback. A persistent store can replace this behind the same
 * interface.
 */
@Repository
public class InMemoryAudioReferenceStore implements AudioReferenceStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryAudioReferenceStore.class);

  private static final Comparator<AudioReference> BY_OFFSET =
      Comparator.comparingLong(AudioReference::offsetMs).thenComparing(AudioReference::blockId);

  private final Map<String, Map<String, AudioReference>> references = new ConcurrentHashMap<>();
  private final Map<String, AudioRecording> recordings = new ConcurrentHashMap<>();

  @Override
  public boolean putAudioReference(AudioReference reference) {
    AudioReference existing =
        references
            .computeIfAbsent(reference.recordingId(), id -> new ConcurrentHashMap<>())
            .putIfAbsent(reference.blockId(), reference);
    if (existing != null) {
      LOGGER.debug(
          "Reference already stored: recordingId={}, blockId={}, keptOffsetMs={}",
          reference.recordingId(),
          reference.blockId(),
          existing.offsetMs());
      return false;
    }
    LOGGER.debug(
        "Stored reference: recordingId={}, blockId={}, offsetMs={}",
        reference.recordingId(),
        reference.blockId(),
        reference.offsetMs());
    return true;
  }

  @Override
  public List<AudioReference> findReferences(String recordingId) {
    Map<String, AudioReference> byBlock = references.get(recordingId);
    if (byBlock == null) {
      return List.of();
    }
    return byBlock.values().stream().sorted(BY_OFFSET).toList();
  }

  @Override
  public Optional<AudioReference> findReference(String recordingId, String blockId) {
    Map<String, AudioReference> byBlock = references.get(recordingId);
    return byBlock == null ? Optional.empty() : Optional.ofNullable(byBlock.get(blockId));
  }

  @Override
  public void saveRecording(AudioRecording recording) {
    recordings.put(recording.id(), recording);
  }

  @Override
  public Optional<AudioRecording> findRecording(String recordingId) {
    return Optional.ofNullable(recordings.get(recordingId));
  }

  @Override
  public List<AudioRecording> findRecordingsForNote(String noteId) {
    return recordings.values().stream()
        .filter(recording -> noteId.equals(recording.noteId()))
        .sorted(Comparator.comparing(AudioRecording::createdAt).thenComparing(AudioRecording::id))
        .toList();
  }
}
