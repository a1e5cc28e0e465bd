package com.brandflow.api;

import com.brandflow.generation.provider.ProviderException;
import com.brandflow.workflow.exception.BrandFlowException;
import com.brandflow.workflow.exception.ExpiredSessionException;
import com.brandflow.workflow.exception.GenerationInProgressException;
import com.brandflow.workflow.exception.SessionNotFoundException;
import com.brandflow.workflow.exception.SessionVersionConflictException;
import com.brandflow.workflow.exception.ValidationException;
import com.brandflow.workflow.exception.VariantNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    @ExceptionHandler(BrandFlowException.class)
    public ResponseEntity<ErrorResponse> handleBrandFlow(BrandFlowException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.error("Request failed with {}", e.getCode(), e);
        } else {
            log.debug("Request rejected with {}: {}", e.getCode(), e.getMessage());
        }
        ErrorResponse error = ErrorResponse.builder()
                .code(e.getCode())
                .message(e.getMessage())
                .timestamp(OffsetDateTime.now())
                .build();
        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler({CompletionException.class, ExecutionException.class})
    public ResponseEntity<ErrorResponse> handleAsyncWrapper(Exception e) {
        Throwable cause = e;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof BrandFlowException brandFlowException) {
            return handleBrandFlow(brandFlowException);
        }
        if (cause instanceof Exception exception && cause != e) {
            return handleGenericException(exception);
        }
        return handleGenericException(e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }
        ErrorResponse error = ErrorResponse.builder()
                .code("VALIDATION_ERROR")
                .message("Request validation failed")
                .timestamp(OffsetDateTime.now())
                .details(Map.of("fieldErrors", fieldErrors))
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        ErrorResponse error = ErrorResponse.builder()
                .code("VALIDATION_ERROR")
                .message("Request body is missing or malformed")
                .timestamp(OffsetDateTime.now())
                .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException e) {
        HttpStatusCode status = e.getStatusCode();
        ErrorResponse error = ErrorResponse.builder()
                .code(status.value() == 403 ? "FORBIDDEN" : status.value() == 404 ? "NOT_FOUND" : "HTTP_" + status.value())
                .message(e.getReason())
                .timestamp(OffsetDateTime.now())
                .build();
        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unhandled exception", e);
        ErrorResponse error = ErrorResponse.builder()
                .code("INTERNAL_ERROR")
                .message("An unexpected error occurred")
                .timestamp(OffsetDateTime.now())
                .details(createDetailsMap(e))
                .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(BrandFlowException e) {
        if (e instanceof ValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof SessionNotFoundException || e instanceof VariantNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof ExpiredSessionException) {
            return HttpStatus.GONE;
        }
        if (e instanceof SessionVersionConflictException || e instanceof GenerationInProgressException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof ProviderException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private Map<String, Object> createDetailsMap(Exception e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("exception", e.getClass().getSimpleName());
        if (e.getCause() != null) {
            details.put("cause", e.getCause().getClass().getSimpleName());
        }
        return details;
    }
}
