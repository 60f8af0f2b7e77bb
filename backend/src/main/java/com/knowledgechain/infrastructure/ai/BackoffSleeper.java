package com.knowledgechain.infrastructure.ai;

import java.time.Duration;

/**
 * Waits between rate-limit retries. Replaced with a recording fake in tests.
 */
@FunctionalInterface
public interface BackoffSleeper {

    void sleep(Duration duration) throws InterruptedException;

    static BackoffSleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
