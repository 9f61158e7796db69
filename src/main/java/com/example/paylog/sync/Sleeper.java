package com.example.paylog.sync;

/**
 * Pause between retry attempts; replaced in tests to record delays instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(long millis) throws InterruptedException;

    static Sleeper threadSleeper() {
        return Thread::sleep;
    }
}
