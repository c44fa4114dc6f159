package com.example.cryptorates.client;

/**
 * 전송 오류로 최대 시도 횟수를 모두 소진
 */
public class RetryExhaustedException extends PriceSourceException {

    private final int attempts;

    public RetryExhaustedException(String endpoint, int attempts, Throwable lastError) {
        super("Price source request to " + endpoint + " failed after " + attempts + " attempts", endpoint, lastError);
        this.attempts = attempts;
    }

    public String getEndpoint() {
        return getTarget();
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public Kind getKind() {
        return Kind.RETRY_EXHAUSTED;
    }
}
