package dev.devanks.mediagen.orchestrator.model;

import lombok.Value;

import java.time.Instant;

@Value
public class QuotaSnapshot {

    int balance;
    Instant queriedAt;
    boolean ok;
}
