package com.scholary.audionotes.api;

import com.scholary.audionotes.block.StructuralException;
import com.scholary.audionotes.codec.DecodeException;
import com.scholary.audionotes.objectstore.ObjectStoreException;
import com.scholary.audionotes.recording.AlreadyRecordingException;
import com.scholary.audionotes.recording.CaptureException;
import com.scholary.audionotes.service.NoteNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps domain failures to HTTP responses with an {@link ApiError} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(AlreadyRecordingException.class)
  public ResponseEntity<ApiError> handleAlreadyRecording(
      AlreadyRecordingException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("Already recording [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.CONFLICT, errorId, ApiError.ALREADY_RECORDING, ex.getMessage(), request);
  }

  @ExceptionHandler(CaptureException.class)
  public ResponseEntity<ApiError> handleCapture(CaptureException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.error("Capture failed [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.BAD_GATEWAY, errorId, ApiError.CAPTURE_FAILED, ex.getMessage(), request);
  }

  @ExceptionHandler(NoteNotFoundException.class)
  public ResponseEntity<ApiError> handleNoteNotFound(
      NoteNotFoundException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("Note not found [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.NOTE_NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(DecodeException.class)
  public ResponseEntity<ApiError> handleDecode(DecodeException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("Snapshot rejected [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.SNAPSHOT_INVALID,
        ex.getMessage(),
        request);
  }

  @ExceptionHandler(StructuralException.class)
  public ResponseEntity<ApiError> handleStructural(
      StructuralException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("Structural edit rejected [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.STRUCTURE_INVALID, ex.getMessage(), request);
  }

  @ExceptionHandler(ObjectStoreException.class)
  public ResponseEntity<ApiError> handleObjectStore(
      ObjectStoreException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.error("Object store failure [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.BAD_GATEWAY, errorId, ApiError.STORAGE_FAILED, "Storage unavailable", request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    LOGGER.warn("Validation failed [{}]: {}", errorId, message);
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({ConstraintViolationException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("Bad request [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, "Malformed request", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred",
        request);
  }

  private static ResponseEntity<ApiError> respond(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(new ApiError(errorId, code, message, request.getRequestURI(), Instant.now()));
  }

  private static String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
