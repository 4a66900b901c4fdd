package com.pagelens.core.util;

import java.time.Duration;

/** 대기 추상화: 크롤 간격(politeness delay)을 테스트에서 기록/생략할 수 있게 한다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
