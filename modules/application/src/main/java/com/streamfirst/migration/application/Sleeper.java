package com.streamfirst.migration.application;

import java.time.Duration;

/**
 * Blocking pause between retries. Swapped for a recording implementation in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
