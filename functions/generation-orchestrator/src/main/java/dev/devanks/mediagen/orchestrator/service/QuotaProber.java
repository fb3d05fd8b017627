package dev.devanks.mediagen.orchestrator.service;

import dev.devanks.mediagen.orchestrator.backend.BackendSession;
import dev.devanks.mediagen.orchestrator.model.QuotaSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Best-effort balance lookup after a successful run. Never throws and never influences the result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuotaProber {

    private final Clock clock;

    /**
     * @return a not-ok snapshot when the query fails or the vendor has no balance to report
     */
    public QuotaSnapshot probe(BackendSession session) {
        if (!session.reportsBalance()) {
            log.debug("{} reports no balance, skipping the query.", session.vendor());
            return new QuotaSnapshot(0, clock.instant(), false);
        }
        try {
            int balance = session.queryBalance();
            log.info("Remaining balance: {}", balance);
            return new QuotaSnapshot(balance, clock.instant(), true);
        } catch (RuntimeException e) {
            log.warn("Balance query failed, leaving it out: {}", e.getMessage());
            return new QuotaSnapshot(0, clock.instant(), false);
        }
    }
}
