package dev.devanks.mediagen.orchestrator.service;

import dev.devanks.mediagen.orchestrator.backend.BackendSession;
import dev.devanks.mediagen.orchestrator.backend.VendorRegistry;
import dev.devanks.mediagen.orchestrator.config.OrchestratorSettings;
import dev.devanks.mediagen.orchestrator.config.SettingsStore;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import dev.devanks.mediagen.orchestrator.model.PollObservation;
import dev.devanks.mediagen.orchestrator.model.StatusQuery;
import dev.devanks.mediagen.orchestrator.model.UpstreamStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Status check of an existing task, typically one that timed out earlier. Optionally keeps refreshing
 * while the task is still running. Upstream errors end up in the returned report instead of being thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskStatusQueryService {

    private final VendorRegistry vendorRegistry;
    private final SettingsStore settingsStore;
    private final DiagnosticMessages diagnosticMessages;
    private final PollSleeper pollSleeper;

    /**
     * @throws IllegalArgumentException on a blank task id or refresh settings out of range
     * @throws ConfigurationException   when the vendor's credentials are missing
     */
    public String check(StatusQuery query) {
        OrchestratorSettings settings = settingsStore.current();
        query.validate();
        settings.requireCredentials(query.getVendor());
        BackendSession session = vendorRegistry.session(query.getVendor(), settings);
        Locale locale = settings.getLocale();
        String id = query.getTaskId().trim();

        int refreshes = 0;
        while (true) {
            Optional<PollObservation> observation;
            try {
                observation = session.poll(id, query.getRoutingKey());
            } catch (ConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Status query for task {} failed: {}", id, e.getMessage(), e);
                return diagnosticMessages.text("status.query-failed", "Status query failed\nTask ID: {0}\nError: {1}",
                        locale, id, e.getMessage());
            }

            if (observation.isEmpty()) {
                return diagnosticMessages.text("status.not-found", "Task not found\nTask ID: {0}", locale, id);
            }
            PollObservation current = observation.get();
            log.info("Task {} is {}.", id, current.getStatus());
            String report = report(id, current, locale);

            if (!query.isAutoRefresh() || current.getStatus() != UpstreamStatus.RUNNING) {
                return report;
            }
            if (refreshes >= query.getMaxRefreshCount()) {
                log.info("Task {} still running after {} refresh(es), stopping.", id, refreshes);
                return report + "\n\n" + diagnosticMessages.text("status.refresh-exhausted",
                        "Reached the maximum of {0} refresh(es), the task may still be running. Check again later.",
                        locale, String.valueOf(query.getMaxRefreshCount()));
            }

            refreshes++;
            log.info("Task {} still running, refresh {} of {} in {}s.", id, refreshes, query.getMaxRefreshCount(),
                    query.getRefreshIntervalSeconds());
            try {
                pollSleeper.sleep(Duration.ofSeconds(query.getRefreshIntervalSeconds()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while refreshing task {}.", id);
                return report + "\n\n" + diagnosticMessages.text("status.refresh-interrupted",
                        "Auto refresh was interrupted, the task may still be running.", locale);
            }
        }
    }

    private String report(String id, PollObservation current, Locale locale) {
        List<String> lines = new ArrayList<>();
        lines.add(diagnosticMessages.text("info.task-id", "Task ID: {0}", locale, id));
        lines.add(diagnosticMessages.text("status." + current.getStatus().name().toLowerCase(Locale.ROOT).replace('_', '-'),
                current.getStatus().name(), locale));
        if (current.getProgress() != null) {
            lines.add(diagnosticMessages.text("status.progress", "Progress: {0}%", locale, String.valueOf(current.getProgress())));
        }
        if (current.getUpstreamMessage() != null && !current.getUpstreamMessage().isBlank()) {
            lines.add(diagnosticMessages.text("status.upstream-message", "Message: {0}", locale, current.getUpstreamMessage()));
        }
        if (!current.getResultUrls().isEmpty()) {
            lines.add(diagnosticMessages.text("status.result-links", "Result links:", locale));
            for (int i = 0; i < current.getResultUrls().size(); i++) {
                lines.add("[" + i + "] " + current.getResultUrls().get(i));
            }
        }
        return String.join("\n", lines);
    }
}
