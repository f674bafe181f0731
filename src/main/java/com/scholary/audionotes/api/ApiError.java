package com.scholary.audionotes.api;

import java.time.Instant;

/**
 * Structured API error response.
 *
 * @param errorId unique id, also written to the log line for the failure
 * @param code machine-readable error code
 * @param message user-facing message
 * @param path request path that failed
 * @param timestamp when the error was produced
 */
public record ApiError(
    String errorId, String code, String message, String path, Instant timestamp) {

  public static final String ALREADY_RECORDING = "RECORDING_001";
  public static final String CAPTURE_FAILED = "RECORDING_002";
  public static final String NOT_RECORDING = "RECORDING_003";
  public static final String NOTE_NOT_FOUND = "NOTE_001";
  public static final String SNAPSHOT_INVALID = "NOTE_002";
  public static final String STRUCTURE_INVALID = "NOTE_003";
  public static final String STORAGE_FAILED = "STORAGE_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";
}
