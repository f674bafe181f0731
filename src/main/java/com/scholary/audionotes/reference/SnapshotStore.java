package com.scholary.audionotes.reference;

import java.util.Optional;

/** Persistence of encoded note snapshots, keyed by note id. */
public interface SnapshotStore {

  /**
   * Load the last saved snapshot of a note.
   *
   * @return the snapshot bytes, or empty if the note was never saved
   */
  Optional<byte[]> loadSnapshot(String noteId);

  void saveSnapshot(String noteId, byte[] snapshot);
}
