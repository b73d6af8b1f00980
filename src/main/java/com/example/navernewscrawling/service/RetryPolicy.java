package com.example.navernewscrawling.service;

import com.example.navernewscrawling.config.CrawlerProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 기사 단위 재시도 정책
 *
 * 최대 시도 횟수 = 1 + retry-count.
 * 대기 시간은 지수 백오프 + 지터 (retryBackoff * 2^(시도-1), 최대 retryBackoffMax).
 */
public class RetryPolicy {

    /** 지터 상한 (ms) */
    private static final int JITTER_MS = 250;

    private final int maxAttempts;
    private final Duration baseBackoff;
    private final Duration maxBackoff;

    public RetryPolicy(int retryCount, Duration baseBackoff, Duration maxBackoff) {
        this.maxAttempts = 1 + Math.max(0, retryCount);
        this.baseBackoff = baseBackoff;
        this.maxBackoff = maxBackoff;
    }

    public static RetryPolicy from(CrawlerProperties properties) {
        return new RetryPolicy(properties.getRetryCount(), properties.getRetryBackoff(), properties.getRetryBackoffMax());
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * @param attemptsMade 지금까지 시도한 횟수 (1부터)
     */
    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * n번째 시도 실패 후 대기 시간 (지터 제외)
     */
    public Duration backoffFor(int attemptsMade) {
        long base = baseBackoff.toMillis();
        if (base <= 0) {
            return Duration.ZERO;
        }
        int exponent = Math.min(Math.max(attemptsMade - 1, 0), 20);
        long backoff = (long) Math.min(maxBackoff.toMillis(), Math.pow(2, exponent) * base);
        return Duration.ofMillis(backoff);
    }

    /**
     * 재시도 전 대기. 취소(인터럽트)되면 즉시 InterruptedException을 던집니다.
     */
    public void sleepBeforeRetry(int attemptsMade) throws InterruptedException {
        long backoff = backoffFor(attemptsMade).toMillis();
        if (backoff > 0) {
            Thread.sleep(backoff + ThreadLocalRandom.current().nextInt(JITTER_MS));
        } else if (Thread.interrupted()) {
            throw new InterruptedException();
        }
    }
}
