package com.di.creatormatch.exception;

import com.di.creatormatch.aspect.ErrorCategory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns exceptions escaping the REST layer into a structured {@link ErrorResponse}.
 * <p>Searches themselves never throw; what reaches this handler is request validation and unexpected
 * framework errors.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Bean validation failures on the request body.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(MethodArgumentNotValidException e) {
        ErrorResponse body = buildErrorResponse(ErrorCategory.VALIDATION_ERROR, "Request validation failed", HttpStatus.BAD_REQUEST);
        for (FieldError fe : e.getBindingResult().getFieldErrors()) {
            body.addDetail(fe.getField(), fe.getDefaultMessage());
        }
        logError("VALIDATION_EXCEPTION", ErrorCategory.VALIDATION_ERROR, e, false);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    /**
     * Unreadable JSON body.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        logError("UNREADABLE_REQUEST", ErrorCategory.SERIALIZATION_ERROR, e, false);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(buildErrorResponse(ErrorCategory.SERIALIZATION_ERROR, "Malformed request body", HttpStatus.BAD_REQUEST));
    }

    /**
     * Handles validation errors (IllegalArgumentException, IllegalStateException).
     */
    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("VALIDATION_EXCEPTION", category, e, false);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(buildErrorResponse(category, messageOf(e), HttpStatus.BAD_REQUEST));
    }

    /**
     * Catch-all.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UNHANDLED_EXCEPTION", category, e, true);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, messageOf(e), HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception, boolean withStack) {
        String requestId = MDC.get("requestId");
        if (withStack) {
            log.error("[API] {} requestId={} category={} path={}", eventType, requestId, category.getName(),
                    getRequestPath(), exception);
        } else {
            log.warn("[API] {} requestId={} category={} path={} message={}", eventType, requestId, category.getName(),
                    getRequestPath(), messageOf(exception));
        }
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, String message, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(message);
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(getRequestPath());
        response.setRequestId(MDC.get("requestId"));
        return response;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private String path;
        private String requestId;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
