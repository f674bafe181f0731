package com.scholary.audionotes.objectstore;

import com.scholary.audionotes.config.AudioNotesProperties;
import com.scholary.audionotes.reference.SnapshotStore;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Keeps one snapshot object per note under {@code <keyPrefix><noteId>.json}. */
@Component
public class ObjectStoreSnapshotStore implements SnapshotStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreSnapshotStore.class);

  static final String CONTENT_TYPE = "application/json";

  private final ObjectStoreClient client;
  private final String bucket;
  private final String keyPrefix;

  public ObjectStoreSnapshotStore(
      ObjectStoreClient client,
      ObjectStoreProperties objectStoreProperties,
      AudioNotesProperties properties) {
    this.client = client;
    this.bucket = objectStoreProperties.bucket();
    this.keyPrefix = properties.snapshots().keyPrefix();
  }

  @Override
  public Optional<byte[]> loadSnapshot(String noteId) {
    String key = keyFor(noteId);
    if (!client.exists(bucket, key)) {
      LOGGER.debug("No snapshot stored: noteId={}, key={}", noteId, key);
      return Optional.empty();
    }
    return Optional.of(client.getObjectBytes(bucket, key));
  }

  @Override
  public void saveSnapshot(String noteId, byte[] snapshot) {
    client.putObjectBytes(bucket, keyFor(noteId), snapshot, CONTENT_TYPE);
  }

  String keyFor(String noteId) {
    if (noteId == null || noteId.isBlank() || noteId.contains("/")) {
      throw new IllegalArgumentException("Invalid note id: " + noteId);
    }
    return keyPrefix + noteId + ".json";
  }
}
