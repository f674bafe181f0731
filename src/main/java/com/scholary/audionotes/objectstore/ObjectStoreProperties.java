package com.scholary.audionotes.objectstore;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the bucket holding note snapshots and recordings.
 *
 * <p>Bound from "objectstore.*". With {@code createBucket} set the bucket is created on startup
 * when missing, which is what a fresh MinIO needs.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess,
    boolean createBucket) {}
