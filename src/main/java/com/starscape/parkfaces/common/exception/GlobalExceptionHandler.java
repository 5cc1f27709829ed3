package com.starscape.parkfaces.common.exception;

import com.starscape.parkfaces.features.closing.app.PurgeFailureException;
import com.starscape.parkfaces.features.extraction.domain.DimensionMismatchException;
import com.starscape.parkfaces.features.extraction.domain.ExtractionUnavailableException;
import com.starscape.parkfaces.features.extraction.domain.UnreadableImageException;
import com.starscape.parkfaces.features.ingestfaces.app.IngestionBackpressureException;
import com.starscape.parkfaces.features.ingestfaces.app.IngestionShutdownException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = ((FieldError) error).getField();
            String errorMessage = error.getDefaultMessage();
            errors.put(fieldName, errorMessage);
        });
        
        ErrorResponse response = new ErrorResponse(
            "VALIDATION_ERROR",
            "Validation failed",
            errors,
            Instant.now()
        );
        
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Malformed request body", null);
    }
    
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), null);
    }
    
    @ExceptionHandler(UnreadableImageException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableImage(UnreadableImageException ex) {
        return error(HttpStatus.BAD_REQUEST, "UNREADABLE_IMAGE", ex.getMessage(), null);
    }
    
    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), null);
    }
    
    @ExceptionHandler(ExtractionUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleExtractionUnavailable(ExtractionUnavailableException ex) {
        log.warn("Face service unavailable: {}", ex.getMessage());
        return error(
            HttpStatus.SERVICE_UNAVAILABLE,
            "FACE_SERVICE_UNAVAILABLE",
            "Face recognition is temporarily unavailable, please try again",
            null
        );
    }
    
    @ExceptionHandler(IngestionBackpressureException.class)
    public ResponseEntity<ErrorResponse> handleBackpressure(IngestionBackpressureException ex) {
        return error(
            HttpStatus.SERVICE_UNAVAILABLE,
            "INGESTION_BUSY",
            ex.getMessage(),
            Map.of("photoId", ex.getPhotoId())
        );
    }
    
    @ExceptionHandler(IngestionShutdownException.class)
    public ResponseEntity<ErrorResponse> handleIngestionShutdown(IngestionShutdownException ex) {
        return error(
            HttpStatus.SERVICE_UNAVAILABLE,
            "SHUTTING_DOWN",
            ex.getMessage(),
            Map.of("photoId", ex.getPhotoId())
        );
    }
    
    @ExceptionHandler(DimensionMismatchException.class)
    public ResponseEntity<ErrorResponse> handleDimensionMismatch(DimensionMismatchException ex) {
        log.error("Embedding dimension mismatch, stored descriptors do not fit the current model", ex);
        return error(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "DATA_INTEGRITY_ERROR",
            ex.getMessage(),
            Map.of(
                "expected", String.valueOf(ex.getExpected()),
                "actual", String.valueOf(ex.getActual())
            )
        );
    }
    
    @ExceptionHandler(PurgeFailureException.class)
    public ResponseEntity<ErrorResponse> handlePurgeFailure(PurgeFailureException ex) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "CLOSING_FAILED", ex.getMessage(), null);
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled exception", ex);
        return error(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "INTERNAL_SERVER_ERROR",
            "An unexpected error occurred: " + ex.getMessage(),
            Map.of("exceptionType", ex.getClass().getSimpleName())
        );
    }
    
    private ResponseEntity<ErrorResponse> error(
            HttpStatus status, String code, String message, Map<String, String> details) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, details, Instant.now()));
    }
    
    public record ErrorResponse(
        String code,
        String message,
        Map<String, String> details,
        Instant timestamp
    ) {}
}
