package com.askdata.web;

import com.askdata.api.ErrorResponse;
import com.askdata.history.HistoryEntryNotFoundException;
import com.askdata.ingest.DatasetLoadException;
import com.askdata.job.JobActiveException;
import com.askdata.job.JobNotFoundException;
import com.askdata.service.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String TRACE_ID = TraceIdFilter.MDC_TRACE_ID;

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Input validation failed", details);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<ErrorResponse> handleMissingParameter(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Input validation failed", ex.getMessage());
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException ex) {
        return respond(HttpStatus.UNAUTHORIZED, "SESSION_EXPIRED", ex.getMessage(), null);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleJobNotFound(JobNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND", ex.getMessage(), null);
    }

    @ExceptionHandler(HistoryEntryNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleHistoryEntryNotFound(HistoryEntryNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "HISTORY_ENTRY_NOT_FOUND", ex.getMessage(), null);
    }

    @ExceptionHandler(JobActiveException.class)
    public ResponseEntity<ErrorResponse> handleJobActive(JobActiveException ex) {
        return respond(HttpStatus.CONFLICT, "JOB_ACTIVE", ex.getMessage(), "active_job_id=" + ex.getActiveJobId());
    }

    @ExceptionHandler(DatasetLoadException.class)
    public ResponseEntity<ErrorResponse> handleDatasetLoad(DatasetLoadException ex) {
        log.warn("Dataset load failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "DATASET_LOAD_FAILED", ex.getMessage(), null);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        return respond(HttpStatus.BAD_REQUEST, "DATASET_LOAD_FAILED", "Uploaded file is too large", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, String details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .traceId(MDC.get(TRACE_ID))
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
