package com.xingest.core.util;

/** 테스트용 고정 시계 */
public final class FrozenClock implements ScrapeClock {
    private long now;

    public FrozenClock(long start) { this.now = start; }

    public void plusMillis(long d) { now += d; }

    @Override public long nowMillis() { return now; }
}
