package com.scholary.audionotes.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the note engine.
 *
 * <p>Controls the auto-tag worker pool, markup export, player stepping, playable-handle caching
 * and where snapshots live in the object store.
 */
@ConfigurationProperties(prefix = "audionotes")
@Validated
public record AudioNotesProperties(
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @NotNull @Valid MarkupProperties markup,
    @NotNull @Valid PlayerProperties player,
    @NotNull @Valid HandleProperties handles,
    @NotNull @Valid SnapshotProperties snapshots) {

  public record MarkupProperties(@NotBlank @Pattern(regexp = "[-*+]") String bulletMarker) {

    public char bulletChar() {
      return bulletMarker.charAt(0);
    }
  }

  public record PlayerProperties(@Positive long skipStepMs) {}

  /** Playable handles are presigned URLs, so the cache TTL must stay below the presign TTL. */
  public record HandleProperties(
      @Positive long cacheMaxSize, @Positive long ttlMinutes, @Positive long presignTtlMinutes) {}

  public record SnapshotProperties(@NotBlank String keyPrefix) {}
}
