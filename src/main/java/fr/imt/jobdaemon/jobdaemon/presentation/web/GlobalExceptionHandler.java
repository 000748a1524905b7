package fr.imt.jobdaemon.jobdaemon.presentation.web;

import fr.imt.jobdaemon.jobdaemon.exception.*;
import fr.imt.jobdaemon.jobdaemon.presentation.web.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Maps exceptions thrown by {@link JobController} to {@link ApiResponse} errors.
 */
@Slf4j
@RestControllerAdvice
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
public class GlobalExceptionHandler {

    // ===== Domain Exception Handlers =====

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleJobNotFound(JobNotFoundException ex) {
        return new ResponseEntity<>(ApiResponse.error(ex.getErrorCode(), ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler({InvalidJobSpecException.class, InvalidScheduleException.class})
    public ResponseEntity<ApiResponse<Void>> handleInvalidJob(JobDaemonException ex) {
        log.warn("Rejected job definition: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getErrorCode(), ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(JobStateException.class)
    public ResponseEntity<ApiResponse<Void>> handleJobState(JobStateException ex) {
        log.warn("Job state conflict: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getErrorCode(), ex.getMessage()), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(JobExecutionException.class)
    public ResponseEntity<ApiResponse<Void>> handleJobExecution(JobExecutionException ex) {
        log.error("Job execution failed: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(ApiResponse.error(ex.getErrorCode(), ex.getMessage()), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    /**
     * Fallback handler for any JobDaemonException not handled above.
     */
    @ExceptionHandler(JobDaemonException.class)
    public ResponseEntity<ApiResponse<Void>> handleJobDaemonException(JobDaemonException ex) {
        log.error("Job daemon exception: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(ApiResponse.error(ex.getErrorCode(), ex.getMessage()), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    // ===== Framework Exception Handlers =====

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFoundException(NoResourceFoundException ex) {
        log.warn("No resource found: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error("Resource Not Found"), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationErrors(MethodArgumentNotValidException ex) {
        String errorMessage = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Validation Failed", errorMessage), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleWrongHttpVerb(HttpRequestMethodNotSupportedException ex) {
        log.warn("Wrong HTTP verb: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error("Method Not Allowed", ex.getMessage()), HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * Missing or malformed JSON body.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleMalformedRequest(HttpMessageNotReadableException ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error("Bad Request"), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        log.warn("Unsupported Media Type: {}", ex.getContentType());
        return new ResponseEntity<>(ApiResponse.error(
                "Unsupported Media Type",
                "API only accepts JSON. Please set 'Content-Type: application/json'"
        ), HttpStatus.UNSUPPORTED_MEDIA_TYPE);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ErrorCodes.INVALID_REQUEST, ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unhandled exception: ", ex);
        return new ResponseEntity<>(ApiResponse.error(
                ErrorCodes.INTERNAL_ERROR,
                "An internal server error occurred"
        ), HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
