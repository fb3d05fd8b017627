package dev.devanks.mediagen.orchestrator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A manual status check of an existing task. With {@code autoRefresh} the check keeps querying while the
 * task is still running, at most {@code maxRefreshCount} more times.
 */
@Value
@Builder
public class StatusQuery {

    public static final int MIN_REFRESH_INTERVAL = 1;
    public static final int MAX_REFRESH_INTERVAL = 60;
    public static final int MIN_REFRESH_COUNT = 1;
    public static final int MAX_REFRESH_COUNT = 100;

    @NonNull
    @Builder.Default
    Vendor vendor = Vendor.HAIYI;
    @NonNull
    String taskId;
    String routingKey; // Haiyi shard, null for the configured default
    @Builder.Default
    boolean autoRefresh = false;
    @Builder.Default
    int refreshIntervalSeconds = 5;
    @Builder.Default
    int maxRefreshCount = 10;

    /**
     * @throws IllegalArgumentException on a blank task id or refresh settings out of range
     */
    public void validate() {
        if (taskId.isBlank()) {
            throw new IllegalArgumentException("Task id must not be blank");
        }
        if (refreshIntervalSeconds < MIN_REFRESH_INTERVAL || refreshIntervalSeconds > MAX_REFRESH_INTERVAL) {
            throw new IllegalArgumentException("refreshInterval must be between " + MIN_REFRESH_INTERVAL + " and "
                    + MAX_REFRESH_INTERVAL + " seconds, got " + refreshIntervalSeconds);
        }
        if (maxRefreshCount < MIN_REFRESH_COUNT || maxRefreshCount > MAX_REFRESH_COUNT) {
            throw new IllegalArgumentException("maxRefreshCount must be between " + MIN_REFRESH_COUNT + " and "
                    + MAX_REFRESH_COUNT + ", got " + maxRefreshCount);
        }
    }
}
