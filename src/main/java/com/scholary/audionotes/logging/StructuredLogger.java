package com.scholary.audionotes.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Recording, tagging and playback events put their own fields into the MDC for the duration of
 * one log call. The recording and note ids are context fields, set once per request or worker task
 * with {@link #setRecordingContext}.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log recording started event. */
  public void logRecordingStarted(String recordingId, String noteId, String filePath) {
    try {
      MDC.put("event_type", "recording_started");
      MDC.put("filePath", filePath);

      logger.info(
          "Recording started: recordingId={}, noteId={}, filePath={}",
          recordingId,
          noteId,
          filePath);
    } finally {
      clearEventFields();
    }
  }

  /** Log recording stopped event; durationMs is null when finalization failed. */
  public void logRecordingStopped(String recordingId, String noteId, Long durationMs) {
    try {
      MDC.put("event_type", "recording_stopped");
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Recording stopped: recordingId={}, noteId={}, durationMs={}",
          recordingId,
          noteId,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log capture failure event. */
  public void logCaptureFailed(String recordingId, String phase, String message) {
    try {
      MDC.put("event_type", "capture_failed");
      MDC.put("phase", phase);

      logger.error(
          "Capture failed: recordingId={}, phase={}, message={}", recordingId, phase, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log block tagged event. */
  public void logBlockTagged(String recordingId, String blockId, long offsetMs) {
    try {
      MDC.put("event_type", "block_tagged");
      MDC.put("blockId", blockId);
      MDC.put("offsetMs", String.valueOf(offsetMs));

      logger.debug(
          "Block tagged: recordingId={}, blockId={}, offsetMs={}", recordingId, blockId, offsetMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log reference write failure event. */
  public void logReferenceWriteFailed(String recordingId, String blockId, Throwable error) {
    try {
      MDC.put("event_type", "reference_write_failed");
      MDC.put("blockId", blockId);
      MDC.put("errorType", error.getClass().getSimpleName());

      logger.error(
          "Reference write failed: recordingId={}, blockId={}", recordingId, blockId, error);
    } finally {
      clearEventFields();
    }
  }

  /** Log player state change event. */
  public void logPlayerState(String source, String playerState, long positionMs) {
    try {
      MDC.put("event_type", "player_state");
      MDC.put("source", source);
      MDC.put("playerState", playerState);
      MDC.put("positionMs", String.valueOf(positionMs));

      logger.debug(
          "Player state: source={}, state={}, positionMs={}", source, playerState, positionMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set recording context in MDC. */
  public static void setRecordingContext(String recordingId, String noteId) {
    MDC.put("recordingId", recordingId);
    MDC.put("noteId", noteId);
  }

  /** Clear recording context from MDC. */
  public static void clearRecordingContext() {
    MDC.remove("recordingId");
    MDC.remove("noteId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("filePath");
    MDC.remove("durationMs");
    MDC.remove("phase");
    MDC.remove("blockId");
    MDC.remove("offsetMs");
    MDC.remove("errorType");
    MDC.remove("source");
    MDC.remove("playerState");
    MDC.remove("positionMs");
  }
}
