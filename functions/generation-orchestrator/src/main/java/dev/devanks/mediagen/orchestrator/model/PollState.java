package dev.devanks.mediagen.orchestrator.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Progress of one poll loop. Elapsed time never decreases; the loop is over once it reaches the max wait.
 */
@Getter
@ToString
public class PollState {

    private final double intervalSeconds;
    private final double maxWaitSeconds;
    private int attempts;
    private double elapsedSeconds;

    public PollState(double intervalSeconds, double maxWaitSeconds) {
        this.intervalSeconds = intervalSeconds;
        this.maxWaitSeconds = maxWaitSeconds;
    }

    public void recordAttempt() {
        attempts++;
    }

    public void advanceTo(double elapsed) {
        // a clock that steps back must not reopen the budget
        elapsedSeconds = Math.max(elapsedSeconds, elapsed);
    }

    public boolean isExhausted() {
        return elapsedSeconds >= maxWaitSeconds;
    }

    public double remainingSeconds() {
        return Math.max(0.0, maxWaitSeconds - elapsedSeconds);
    }
}
