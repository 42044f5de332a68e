package tech.yump.secretsync.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.secretsync.api.SyncNotFoundException;
import tech.yump.secretsync.provider.error.ConfigurationException;
import tech.yump.secretsync.provider.error.SecretSyncException;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(SyncNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleSyncNotFound(SyncNotFoundException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.NOT_FOUND;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Sync Not Found");
        log.warn("Sync not found: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler({ConfigurationException.class, IllegalArgumentException.class})
    public ResponseEntity<ProblemDetail> handleBadRequest(RuntimeException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(SecretSyncException.class)
    public ResponseEntity<ProblemDetail> handleSecretSyncException(SecretSyncException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_GATEWAY;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Secret Sync Error");
        problemDetail.setProperty("kind", ex.getKind().name());
        problemDetail.setProperty("retryable", ex.isRetryable());
        log.error("Secret sync error ({}): {}. Request: {} {}", ex.getKind(), ex.getMessage(), request.getMethod(),
                request.getRequestURI(), ex);
        return ResponseEntity.status(status).body(problemDetail);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {
        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: Malformed JSON received. Request: {}. Details: {}", request.getDescription(false), ex.getMessage());
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, "An unexpected internal error occurred.");
        problemDetail.setTitle("Internal Server Error");
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(status).body(problemDetail);
    }
}
