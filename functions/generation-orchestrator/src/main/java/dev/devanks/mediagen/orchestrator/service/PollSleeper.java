package dev.devanks.mediagen.orchestrator.service;

import java.time.Duration;

/**
 * Blocking wait between two status queries.
 */
@FunctionalInterface
public interface PollSleeper {

    void sleep(Duration duration) throws InterruptedException;

    static PollSleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
