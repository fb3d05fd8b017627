package dev.devanks.mediagen.orchestrator.model;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single remote generation job owned by one orchestrator invocation.
 * Status only moves forward; once terminal it is frozen.
 */
@Getter
@ToString(exclude = "assets")
public class Task {

    private final Instant submittedAt;
    private String id;
    private String routingKey; // vendor shard/channel needed to query the task again, may be null
    private TaskStatus status = TaskStatus.SUBMITTED;
    private final List<Asset> assets = new ArrayList<>();
    private ErrorInfo errorInfo;

    public Task(Instant submittedAt) {
        this.submittedAt = Objects.requireNonNull(submittedAt, "submittedAt");
    }

    public void assignId(String taskId, String routingKey) {
        if (id != null) {
            throw new IllegalStateException("Task id already assigned: " + id);
        }
        this.id = Objects.requireNonNull(taskId, "taskId");
        this.routingKey = routingKey;
    }

    /**
     * Moves the task to {@code next}. Repeating the current non-terminal status is a no-op.
     *
     * @throws IllegalStateException if the task is already terminal or {@code next} would go backwards
     */
    public void transitionTo(TaskStatus next) {
        Objects.requireNonNull(next, "next");
        if (status.isTerminal()) {
            throw new IllegalStateException("Task " + id + " is already " + status + ", cannot move to " + next);
        }
        if (next == TaskStatus.SUBMITTED && status == TaskStatus.RUNNING) {
            throw new IllegalStateException("Task " + id + " cannot return to SUBMITTED");
        }
        status = next;
    }

    public void fail(TaskStatus terminalStatus, ErrorInfo error) {
        if (!terminalStatus.isTerminal() || terminalStatus == TaskStatus.SUCCEEDED) {
            throw new IllegalArgumentException("Not a failure status: " + terminalStatus);
        }
        transitionTo(terminalStatus);
        this.errorInfo = error;
    }

    public void addAsset(Asset asset) {
        if (!assets.isEmpty() && assets.get(assets.size() - 1).getIndex() >= asset.getIndex()) {
            throw new IllegalArgumentException("Assets must be added in index order, got " + asset.getIndex());
        }
        assets.add(asset);
    }

    public List<Asset> getAssets() {
        return Collections.unmodifiableList(assets);
    }
}
