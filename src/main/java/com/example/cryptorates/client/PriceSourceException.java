package com.example.cryptorates.client;

/**
 * 시세 제공처 호출 실패 공통 예외
 * kind 로 재시도 여부와 외부 에러 코드를 구분한다.
 */
public abstract class PriceSourceException extends RuntimeException {

    public enum Kind {
        UNSUPPORTED_PAIR(false),
        TRANSPORT(true),
        PROTOCOL(false),
        DECODING(false),
        INVALID_RESPONSE(false),
        RETRY_EXHAUSTED(false);

        private final boolean retryable;

        Kind(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    private final String target;

    protected PriceSourceException(String message, String target, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public abstract Kind getKind();

    /**
     * 실패 대상 (거래쌍 또는 엔드포인트)
     */
    public String getTarget() {
        return target;
    }
}
