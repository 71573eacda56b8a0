package com.walletfeed.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class WalletFeedExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(WalletFeedExceptionHandler.class);

    @ExceptionHandler(WalletFeedException.class)
    public ResponseEntity<WalletFeedErrorResponse> handle(WalletFeedException ex) {
        log.debug("Rejected request with {} ({}): {}", ex.getStatus(), ex.getCode(), ex.getMessage());
        return ResponseEntity
                .status(ex.getStatus())
                .body(new WalletFeedErrorResponse(ex.getCode(), ex.getMessage(), null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<WalletFeedErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest()
                .body(new WalletFeedErrorResponse("bad_request", ex.getMessage(), null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<WalletFeedErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fe ->
                fieldErrors.putIfAbsent(fe.getField(), fe.getDefaultMessage())
        );

        String detail = fieldErrors.isEmpty()
                ? "Validation failed"
                : "Validation failed: " + String.join("; ", fieldErrors.values());

        return ResponseEntity.badRequest()
                .body(new WalletFeedErrorResponse("validation_failed", detail, fieldErrors));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record WalletFeedErrorResponse(
            String code,
            String message,
            Map<String, String> fieldErrors
    ) {
    }
}
