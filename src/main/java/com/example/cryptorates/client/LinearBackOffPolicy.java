package com.example.cryptorates.client;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/**
 * n번째 실패 후 baseDelayMs * n 만큼 대기하는 선형 백오프
 * (Spring Retry 기본 제공 정책은 고정/지수 증가만 있다)
 */
public class LinearBackOffPolicy implements BackOffPolicy {

    private final long baseDelayMs;
    private final Sleeper sleeper;

    public LinearBackOffPolicy(long baseDelayMs) {
        this(baseDelayMs, new ThreadWaitSleeper());
    }

    public LinearBackOffPolicy(long baseDelayMs, Sleeper sleeper) {
        this.baseDelayMs = baseDelayMs;
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new LinearBackOffContext(context);
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        int failures = ((LinearBackOffContext) backOffContext).retryContext().getRetryCount();
        long delay = baseDelayMs * failures;
        if (delay <= 0) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Interrupted while waiting " + delay + "ms before retry", e);
        }
    }

    private record LinearBackOffContext(RetryContext retryContext) implements BackOffContext {
    }
}
