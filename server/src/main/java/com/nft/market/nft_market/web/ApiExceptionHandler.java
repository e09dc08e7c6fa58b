package com.nft.market.nft_market.web;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.nft.market.nft_market.error.ErrorKind;
import com.nft.market.nft_market.error.MarketplaceException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps rejected operations to HTTP responses with body {@code {"error", "message"}}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MarketplaceException.class)
    public ResponseEntity<Map<String, String>> handleMarketplace(MarketplaceException e) {
        HttpStatus status = statusOf(e.getKind());
        if (e.getKind() == ErrorKind.TRANSFER_FAILURE) {
            log.warn("Transfer failed: {}", e.getMessage());
        } else {
            log.debug("Rejected: {} {}", e.getKind(), e.getMessage());
        }
        return body(status, e.getKind().name(), e.getMessage());
    }

    @ExceptionHandler({ IllegalArgumentException.class, MethodArgumentNotValidException.class,
            HttpMessageNotReadableException.class })
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return body(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_PARAMETERS.name(), e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> handleInternal(IllegalStateException e) {
        log.error("Ledger invariant violated", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal ledger error");
    }

    static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case INVALID_STATE:
                return HttpStatus.CONFLICT;
            case UNAUTHORIZED:
                return HttpStatus.FORBIDDEN;
            case INSUFFICIENT_FUNDS:
                return HttpStatus.PAYMENT_REQUIRED;
            case INELIGIBLE_ASSET:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_PARAMETERS:
                return HttpStatus.BAD_REQUEST;
            case TRANSFER_FAILURE:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", error, "message", message == null ? "" : message));
    }
}
