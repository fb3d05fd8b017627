package dev.devanks.mediagen.orchestrator.service;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import dev.devanks.mediagen.orchestrator.backend.BackendSession;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import dev.devanks.mediagen.orchestrator.model.ErrorInfo;
import dev.devanks.mediagen.orchestrator.model.FailureCategory;
import dev.devanks.mediagen.orchestrator.model.PollObservation;
import dev.devanks.mediagen.orchestrator.model.PollOutcome;
import dev.devanks.mediagen.orchestrator.model.PollState;
import dev.devanks.mediagen.orchestrator.model.Task;
import dev.devanks.mediagen.orchestrator.model.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Blocking wait-then-query loop over one task.
 * <p>
 * One query per interval, no backoff. Transient errors and empty answers count as "no new information".
 * The budget is checked before every query: once the elapsed time reaches it, no further query is sent and
 * the task is TIMED_OUT whatever upstream last said.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TaskPoller {

    private final Ticker pollTicker;
    private final PollSleeper pollSleeper;

    public PollOutcome await(BackendSession session, Task task, Duration interval, Duration maxWait) {
        PollState state = new PollState(toSeconds(interval), toSeconds(maxWait));
        Stopwatch stopwatch = Stopwatch.createStarted(pollTicker);
        PollObservation last = null;
        log.info("Polling task {} every {}s for at most {}s.", task.getId(), state.getIntervalSeconds(), state.getMaxWaitSeconds());

        while (!state.isExhausted()) {
            state.recordAttempt();
            Optional<PollObservation> observation = query(session, task);
            state.advanceTo(elapsedSeconds(stopwatch));

            if (observation.isPresent()) {
                last = observation.get();
                apply(task, last);
                if (task.getStatus().isTerminal()) {
                    break;
                }
            }
            if (state.isExhausted()) {
                break;
            }

            long waitNanos = (long) (Math.min(state.getIntervalSeconds(), state.remainingSeconds()) * 1_000_000_000L);
            try {
                pollSleeper.sleep(Duration.ofNanos(waitNanos));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for task {}.", task.getId());
                task.fail(TaskStatus.TIMED_OUT, ErrorInfo.of(FailureCategory.POLL_TIMEOUT, "interrupted while waiting"));
                break;
            }
            state.advanceTo(elapsedSeconds(stopwatch));
        }

        if (!task.getStatus().isTerminal()) {
            log.warn("Task {} still {} after {} attempt(s) in {}s, giving up.",
                    task.getId(), task.getStatus(), state.getAttempts(), state.getElapsedSeconds());
            task.fail(TaskStatus.TIMED_OUT, ErrorInfo.of(FailureCategory.POLL_TIMEOUT,
                    "no terminal status after " + (long) state.getMaxWaitSeconds() + "s"));
        }

        List<String> urls = task.getStatus() == TaskStatus.SUCCEEDED && last != null ? last.getResultUrls() : List.of();
        log.info("Polling of task {} ended as {} after {} attempt(s).", task.getId(), task.getStatus(), state.getAttempts());
        return new PollOutcome(task.getStatus(), urls, state, last);
    }

    private Optional<PollObservation> query(BackendSession session, Task task) {
        try {
            Optional<PollObservation> observation = session.poll(task.getId(), task.getRoutingKey());
            if (observation.isEmpty()) {
                log.debug("No progress entry for task {} yet.", task.getId());
            }
            return observation;
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Progress query for task {} failed, retrying next interval: {}", task.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private void apply(Task task, PollObservation observation) {
        switch (observation.getStatus()) {
            case RUNNING -> {
                if (task.getStatus() == TaskStatus.SUBMITTED) {
                    task.transitionTo(TaskStatus.RUNNING);
                }
                log.info("Task {} running, progress {}%.", task.getId(),
                        observation.getProgress() != null ? observation.getProgress() : "?");
            }
            case SUCCESS -> task.transitionTo(TaskStatus.SUCCEEDED);
            case UPSTREAM_CANCELLED -> task.fail(TaskStatus.CANCELLED, ErrorInfo.of(FailureCategory.UPSTREAM_CANCELLATION,
                    "cancelled upstream (status " + observation.getUpstreamCode() + ")"));
            case CONTENT_POLICY_REJECTED -> task.fail(TaskStatus.FAILED, ErrorInfo.of(FailureCategory.CONTENT_POLICY_REJECTION,
                    "content policy (status " + observation.getUpstreamCode() + ")"));
            case GENERIC_FAILURE -> task.fail(TaskStatus.FAILED, ErrorInfo.of(FailureCategory.UPSTREAM_FAILURE,
                    "upstream status " + observation.getUpstreamCode()
                            + (observation.getUpstreamMessage() != null ? ": " + observation.getUpstreamMessage() : "")));
        }
    }

    private static double elapsedSeconds(Stopwatch stopwatch) {
        return stopwatch.elapsed(TimeUnit.NANOSECONDS) / 1_000_000_000.0;
    }

    private static double toSeconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
