package com.example.cryptorates.client;

/**
 * price 필드 누락, 0 이하 가격 등 응답 내용 오류
 */
public class InvalidPriceResponseException extends PriceSourceException {

    public InvalidPriceResponseException(String target, String message) {
        super(message, target, null);
    }

    @Override
    public Kind getKind() {
        return Kind.INVALID_RESPONSE;
    }
}
