package com.scholary.audionotes.objectstore;

import java.net.URL;
import java.time.Duration;

/**
 * Abstraction for object storage operations.
 *
 * <p>Note snapshots are small JSON documents, so they move as byte arrays. Recordings are never
 * read through the application: players fetch them from presigned URLs.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve a whole object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return the object content
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  byte[] getObjectBytes(String bucket, String key);

  /**
   * Store an object, replacing any existing one under the same key.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the object content
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObjectBytes(String bucket, String key, byte[] data, String contentType);

  /**
   * Check whether an object exists without downloading it.
   *
   * @throws ObjectStoreException if the check itself fails
   */
  boolean exists(String bucket, String key);

  /**
   * Generate a presigned URL for temporary read access to an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param ttl time-to-live for the URL
   * @return a presigned URL
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);
}
