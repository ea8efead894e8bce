package com.groceryai.interfaces.api;

import com.groceryai.infrastructure.ai.GuardrailBlockedException;
import com.groceryai.infrastructure.ai.InvalidRequestException;
import com.groceryai.infrastructure.ai.InvocationCancelledException;
import com.groceryai.infrastructure.ai.ModelInvocationException;
import com.groceryai.infrastructure.ai.ModelUnavailableException;
import com.groceryai.infrastructure.ai.RateLimitException;
import com.groceryai.interfaces.api.dto.ErrorResponse;
import com.groceryai.interfaces.api.dto.ViolationEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(GuardrailBlockedException.class)
    public ResponseEntity<ErrorResponse> handleGuardrailBlocked(GuardrailBlockedException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("GUARDRAIL_BLOCKED", e.getMessage(), ViolationEntry.from(e.getViolations())));
    }

    @ExceptionHandler(RateLimitException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitException e) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
        if (e.getRetryAfter() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, e.getRetryAfter().toSeconds())));
        }
        return builder.body(new ErrorResponse("RATE_LIMITED", "Model rate limit exceeded. Please retry later."));
    }

    @ExceptionHandler(ModelUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(ModelUnavailableException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("MODEL_UNAVAILABLE", "Model is temporarily unavailable."));
    }

    @ExceptionHandler(InvocationCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(InvocationCancelledException e) {
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(new ErrorResponse("INVOCATION_CANCELLED", e.getMessage()));
    }

    @ExceptionHandler(ModelInvocationException.class)
    public ResponseEntity<ErrorResponse> handleInvocation(ModelInvocationException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("MODEL_ERROR", "Model invocation failed (" + e.getErrorCode() + ")"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("Invalid request.");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[GlobalExceptionHandler] Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "Internal server error. Please try again later."));
    }
}
