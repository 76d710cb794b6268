package io.jobkeeper.config;

import java.time.Duration;

/**
 * Runtime configuration for scheduler behavior. Bound under the {@code jobkeeper} prefix by the
 * Spring Boot starter.
 */
public class SchedulerProperties {
    private boolean enabled = true;
    private boolean autoStartup = true;
    private Duration tickInterval = Duration.ofSeconds(1);
    private int maxConcurrency = 4; // worker pool size
    private int batchSize = 100; // due jobs per tick
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);
    private Duration misfireThreshold = Duration.ofSeconds(5);
    private String ownerId;
    private boolean singleInstancePerProcess = true;
    private int maxCompletionAttempts = 10;
    private Duration executionRetention = Duration.ofDays(30);
    private boolean ensureIndexesOnStartup = false;
    private Duration staleRunTimeout = Duration.ofMinutes(1); // heartbeat silence before a run counts as orphaned

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public Duration getMisfireThreshold() {
        return misfireThreshold;
    }

    public void setMisfireThreshold(Duration misfireThreshold) {
        this.misfireThreshold = misfireThreshold;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    /**
     * The configured owner id, or a generated one that is then kept for the lifetime of this
     * object so that every component of one scheduler records the same owner.
     */
    public synchronized String resolveOwnerId() {
        if (ownerId == null || ownerId.isBlank()) {
            ownerId = OwnerIds.resolve(null);
        }
        return ownerId;
    }

    public boolean isSingleInstancePerProcess() {
        return singleInstancePerProcess;
    }

    public void setSingleInstancePerProcess(boolean singleInstancePerProcess) {
        this.singleInstancePerProcess = singleInstancePerProcess;
    }

    public int getMaxCompletionAttempts() {
        return maxCompletionAttempts;
    }

    public void setMaxCompletionAttempts(int maxCompletionAttempts) {
        this.maxCompletionAttempts = maxCompletionAttempts;
    }

    public Duration getExecutionRetention() {
        return executionRetention;
    }

    public void setExecutionRetention(Duration executionRetention) {
        this.executionRetention = executionRetention;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Duration getStaleRunTimeout() {
        return staleRunTimeout;
    }

    public void setStaleRunTimeout(Duration staleRunTimeout) {
        this.staleRunTimeout = staleRunTimeout;
    }
}
