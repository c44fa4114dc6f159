package com.example.cryptorates.client;

/**
 * 응답 본문 JSON 파싱 실패 (재시도하지 않음)
 */
public class PriceSourceDecodingException extends PriceSourceException {

    public PriceSourceDecodingException(String endpoint, Throwable cause) {
        super("JSON decoding error: " + cause.getMessage(), endpoint, cause);
    }

    @Override
    public Kind getKind() {
        return Kind.DECODING;
    }
}
