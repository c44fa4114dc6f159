package com.example.cryptorates.controller;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 에러 응답 본문. details 는 api.debug=true 일 때만 채워진다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(String error, String message, String details) {

    public static ApiError of(String error, String message) {
        return new ApiError(error, message, null);
    }
}
