package com.xingest.core.util;

/** 캐시 만료/소요시간 계산용 시계. 테스트에서 고정 시계로 교체한다. */
@FunctionalInterface
public interface ScrapeClock {
    long nowMillis();

    ScrapeClock SYSTEM = System::currentTimeMillis;
}
