package com.example.cryptorates.client;

/**
 * 연결/타임아웃 등 전송 계층 오류 (재시도 대상)
 */
public class PriceSourceTransportException extends PriceSourceException {

    private final int attempt;

    public PriceSourceTransportException(String endpoint, int attempt, Throwable cause) {
        super("Transport error on attempt " + attempt + ": " + cause.getMessage(), endpoint, cause);
        this.attempt = attempt;
    }

    public int getAttempt() {
        return attempt;
    }

    @Override
    public Kind getKind() {
        return Kind.TRANSPORT;
    }
}
