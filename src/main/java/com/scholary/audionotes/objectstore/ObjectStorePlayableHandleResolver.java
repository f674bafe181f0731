package com.scholary.audionotes.objectstore;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.audionotes.config.AudioNotesProperties;
import com.scholary.audionotes.playback.SourceLoadException;
import com.scholary.audionotes.reference.PlayableHandleResolver;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves recording paths to something a player can open.
 *
 * <p>A path naming an existing local file (a capture made on this machine) resolves to its
 * {@code file:} URI. Anything else is treated as an object key in the configured bucket and
 * resolves to a presigned URL. Handles are cached for less than the presign lifetime, so a cached
 * URL is always still valid when handed out.
 */
@Component
public class ObjectStorePlayableHandleResolver implements PlayableHandleResolver {

  private static final Logger LOGGER =
      LoggerFactory.getLogger(ObjectStorePlayableHandleResolver.class);

  private final ObjectStoreClient client;
  private final String bucket;
  private final Duration presignTtl;
  private final Cache<String, URI> cache;

  public ObjectStorePlayableHandleResolver(
      ObjectStoreClient client,
      ObjectStoreProperties objectStoreProperties,
      AudioNotesProperties properties) {
    AudioNotesProperties.HandleProperties handles = properties.handles();
    if (handles.ttlMinutes() >= handles.presignTtlMinutes()) {
      throw new IllegalArgumentException(
          "Handle cache TTL must be shorter than the presign TTL: ttlMinutes="
              + handles.ttlMinutes()
              + ", presignTtlMinutes="
              + handles.presignTtlMinutes());
    }

    this.client = client;
    this.bucket = objectStoreProperties.bucket();
    this.presignTtl = Duration.ofMinutes(handles.presignTtlMinutes());
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(handles.cacheMaxSize())
            .expireAfterWrite(Duration.ofMinutes(handles.ttlMinutes()))
            .build();

    LOGGER.info(
        "Initialized handle cache: maxSize={}, ttlMinutes={}, presignTtlMinutes={}",
        handles.cacheMaxSize(),
        handles.ttlMinutes(),
        handles.presignTtlMinutes());
  }

  @Override
  public URI resolvePlayableHandle(String filePath) {
    if (filePath == null || filePath.isBlank()) {
      throw new SourceLoadException("Recording has no file path");
    }

    URI cached = cache.getIfPresent(filePath);
    if (cached != null) {
      LOGGER.debug("Handle cache hit: filePath={}", filePath);
      return cached;
    }

    URI handle = localFile(filePath);
    if (handle == null) {
      handle = presign(filePath);
    }
    cache.put(filePath, handle);
    return handle;
  }

  private URI localFile(String filePath) {
    try {
      Path path = Path.of(filePath);
      return Files.isRegularFile(path) ? path.toAbsolutePath().toUri() : null;
    } catch (InvalidPathException e) {
      LOGGER.debug("Not a local path, treating as object key: filePath={}", filePath);
      return null;
    }
  }

  private URI presign(String key) {
    String objectKey = key.startsWith("/") ? key.substring(1) : key;
    try {
      return client.presignGet(bucket, objectKey, presignTtl).toURI();
    } catch (ObjectStoreException e) {
      throw new SourceLoadException("Cannot resolve recording " + key + ": " + e.getMessage(), e);
    } catch (URISyntaxException e) {
      throw new SourceLoadException("Presigned URL for " + key + " is not a valid URI", e);
    }
  }
}
