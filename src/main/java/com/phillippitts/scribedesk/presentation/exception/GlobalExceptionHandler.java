package com.phillippitts.scribedesk.presentation.exception;

import com.phillippitts.scribedesk.exception.AudioCaptureException;
import com.phillippitts.scribedesk.exception.ExportException;
import com.phillippitts.scribedesk.exception.FailureKind;
import com.phillippitts.scribedesk.exception.InvalidOperationException;
import com.phillippitts.scribedesk.exception.ModelLoadException;
import com.phillippitts.scribedesk.exception.RecognitionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts typed session failures to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping file paths and transcript text away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Microphone could not be opened (HTTP 503).
     */
    @ExceptionHandler(AudioCaptureException.class)
    ResponseEntity<ApiError> handleCapture(AudioCaptureException ex) {
        LOG.warn("Capture failed: reason={}", ex.getReason());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(), FailureKind.CAPTURE,
                "Microphone unavailable",
                "Check the input device and microphone permissions (" + ex.getReason() + ")");
    }

    /**
     * Model missing or unreadable (HTTP 503).
     */
    @ExceptionHandler(ModelLoadException.class)
    ResponseEntity<ApiError> handleModelLoad(ModelLoadException ex) {
        LOG.error("Model load failed at path: {}", ex.getModelPath());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(), FailureKind.MODEL_LOAD,
                "Recognition model unavailable",
                "Select a valid model directory and retry");
    }

    /**
     * Recognizer failure outside the per-frame path (HTTP 503).
     */
    @ExceptionHandler(RecognitionException.class)
    ResponseEntity<ApiError> handleRecognition(RecognitionException ex) {
        LOG.error("Recognition failed: engine={}", ex.getEngineName(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(), FailureKind.RECOGNITION,
                "Recognition temporarily unavailable",
                "Please retry in a few seconds");
    }

    /**
     * Export could not be written (HTTP 500).
     */
    @ExceptionHandler(ExportException.class)
    ResponseEntity<ApiError> handleExport(ExportException ex) {
        LOG.error("Export failed: target={}", ex.getTargetPath(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(), FailureKind.EXPORT,
                "Export failed",
                "No file was written. Check the target directory and free space");
    }

    /**
     * Command not valid in the current state (HTTP 409).
     */
    @ExceptionHandler(InvalidOperationException.class)
    ResponseEntity<ApiError> handleInvalidOperation(InvalidOperationException ex) {
        LOG.info("Rejected command: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getClass().getSimpleName(), FailureKind.INVALID_OPERATION,
                "Operation not allowed",
                ex.getMessage());
    }

    /**
     * Client error - invalid request body (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return error(HttpStatus.BAD_REQUEST, "ValidationError", null, "Invalid request", details);
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", null,
                "An unexpected error occurred",
                "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, FailureKind kind,
                                                  String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(code, kind, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        FailureKind kind,
        String message,
        String details,
        Instant timestamp
    ) {}
}
