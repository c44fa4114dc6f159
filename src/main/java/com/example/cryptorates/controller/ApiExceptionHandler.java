package com.example.cryptorates.controller;

import com.example.cryptorates.client.PriceSourceException;
import com.example.cryptorates.client.UnsupportedPairException;
import com.example.cryptorates.config.ApiProperties;
import com.example.cryptorates.service.InvalidRateQueryException;
import com.example.cryptorates.service.RateServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 예외 → 외부 에러 코드/상태 변환
 * 내부 예외 메시지는 api.debug=true 일 때만 details 로 내려간다.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler {

    private final ApiProperties apiProperties;

    @ExceptionHandler(UnsupportedPairException.class)
    public ResponseEntity<ApiError> handleUnsupportedPair(UnsupportedPairException e) {
        return ResponseEntity.badRequest().body(ApiError.of("Invalid pair", e.getMessage()));
    }

    @ExceptionHandler(InvalidRateQueryException.class)
    public ResponseEntity<ApiError> handleInvalidQuery(InvalidRateQueryException e) {
        return ResponseEntity.badRequest().body(ApiError.of("Validation failed", e.getMessage()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        return ResponseEntity.badRequest().body(ApiError.of("Validation failed",
                "Missing required parameter: " + e.getParameterName()));
    }

    @ExceptionHandler(RateServiceException.class)
    public ResponseEntity<ApiError> handleServiceError(RateServiceException e) {
        log.error("[서비스 오류] {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Service error",
                "Failed to process rate request", e);
    }

    @ExceptionHandler(PriceSourceException.class)
    public ResponseEntity<ApiError> handlePriceSource(PriceSourceException e) {
        log.error("[시세 제공처 오류] kind={}, target={}, error={}", e.getKind(), e.getTarget(), e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "Price source error",
                "Failed to fetch prices from price source", e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception e) {
        log.error("[처리되지 않은 오류] {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error",
                "An unexpected error occurred", e);
    }

    private ResponseEntity<ApiError> error(HttpStatus status, String error, String message, Exception e) {
        String details = apiProperties.isDebug() ? detailOf(e) : null;
        return ResponseEntity.status(status).body(new ApiError(error, message, details));
    }

    private static String detailOf(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root == e ? e.getMessage() : e.getMessage() + " (cause: " + root.getMessage() + ")";
    }
}
