package com.xingest.core.util;

import java.time.Duration;

/** 대기 추상화(테스트에서 실제 sleep 없이 호출 기록용) */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
