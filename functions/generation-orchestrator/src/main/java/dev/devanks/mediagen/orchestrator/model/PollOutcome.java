package dev.devanks.mediagen.orchestrator.model;

import lombok.Value;

import java.util.List;

/**
 * What the poller hands on: the terminal status it settled on, the result URLs when it succeeded,
 * and the loop bookkeeping.
 */
@Value
public class PollOutcome {

    TaskStatus status;
    List<String> resultUrls;
    PollState pollState;
    PollObservation lastObservation;
}
