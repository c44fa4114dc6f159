package com.example.cryptorates.client;

/**
 * 4xx/5xx 등 HTTP 수준 오류 (재시도하지 않음)
 */
public class PriceSourceProtocolException extends PriceSourceException {

    private final int statusCode;

    public PriceSourceProtocolException(String endpoint, int statusCode, Throwable cause) {
        super("HTTP " + statusCode + " response from price source", endpoint, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public Kind getKind() {
        return Kind.PROTOCOL;
    }
}
