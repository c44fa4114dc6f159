package com.example.cryptorates.service;

/**
 * 잘못된 조회 조건 (형식이 틀린 날짜, 미래 날짜 등)
 */
public class InvalidRateQueryException extends RuntimeException {

    private final String field;

    public InvalidRateQueryException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
