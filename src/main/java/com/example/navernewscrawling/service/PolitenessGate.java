package com.example.navernewscrawling.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 요청 간격 제한
 *
 * 작업자 수와 무관하게, 사이트로 보내는 연속된 요청의 시작 시각이
 * 최소 interval 이상 벌어지도록 보장합니다. (전체 작업자 공통)
 * 각 호출자는 잠금 안에서 자기 시작 시각(슬롯)만 예약하고, 대기는 잠금 밖에서 합니다.
 */
@Slf4j
public class PolitenessGate {

    private final long intervalNanos;

    private boolean started;
    private long lastSlot;

    public PolitenessGate(Duration interval) {
        this.intervalNanos = interval.toNanos();
    }

    /**
     * 다음 요청을 보내도 될 때까지 대기합니다.
     *
     * @throws InterruptedException 대기 중 취소된 경우
     */
    public void acquire() throws InterruptedException {
        if (intervalNanos <= 0) {
            if (Thread.interrupted()) {
                throw new InterruptedException();
            }
            return;
        }
        long waitNanos;
        synchronized (this) {
            long now = System.nanoTime();
            long slot = started ? Math.max(now, lastSlot + intervalNanos) : now;
            lastSlot = slot;
            started = true;
            waitNanos = slot - now;
        }
        if (waitNanos > 0) {
            log.trace("요청 간격 대기 {}ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        } else if (Thread.interrupted()) {
            throw new InterruptedException();
        }
    }
}
