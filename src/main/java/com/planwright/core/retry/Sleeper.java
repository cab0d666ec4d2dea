package com.planwright.core.retry;

import java.time.Duration;

/**
 * Blocks the calling thread between retry attempts. Replaced in tests to record delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
