package com.example.cryptorates.service;

/**
 * 조회/적재 경계에서 예상하지 못한 실패를 감싸는 예외
 */
public class RateServiceException extends RuntimeException {

    public RateServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
