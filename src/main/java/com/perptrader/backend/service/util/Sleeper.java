package com.perptrader.backend.service.util;

/**
 * Blocking pause, swapped for a no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
