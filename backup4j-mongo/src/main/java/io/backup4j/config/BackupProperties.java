package io.backup4j.config;

import io.backup4j.core.ServerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration for the backup scheduler and worker.
 */
@ConfigurationProperties(prefix = "backup4j")
public class BackupProperties {
    private Duration maxScheduleWait = Duration.ofMinutes(5);
    private Duration minScheduleWait = Duration.ofMillis(100);
    private Duration idleScheduleWait = Duration.ofMinutes(1);
    private int maxSearchIterations = 50_000;
    private int recentEventCapacity = 100;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean ensureIndexesOnStartup = false;

    public Duration getMaxScheduleWait() {
        return maxScheduleWait;
    }

    public void setMaxScheduleWait(Duration maxScheduleWait) {
        this.maxScheduleWait = maxScheduleWait;
    }

    public Duration getMinScheduleWait() {
        return minScheduleWait;
    }

    public void setMinScheduleWait(Duration minScheduleWait) {
        this.minScheduleWait = minScheduleWait;
    }

    public Duration getIdleScheduleWait() {
        return idleScheduleWait;
    }

    public void setIdleScheduleWait(Duration idleScheduleWait) {
        this.idleScheduleWait = idleScheduleWait;
    }

    public int getMaxSearchIterations() {
        return maxSearchIterations;
    }

    public void setMaxSearchIterations(int maxSearchIterations) {
        this.maxSearchIterations = maxSearchIterations;
    }

    public int getRecentEventCapacity() {
        return recentEventCapacity;
    }

    public void setRecentEventCapacity(int recentEventCapacity) {
        this.recentEventCapacity = recentEventCapacity;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public ServerSettings toServerSettings() {
        return new ServerSettings(
                maxScheduleWait,
                minScheduleWait,
                idleScheduleWait,
                maxSearchIterations,
                recentEventCapacity,
                shutdownTimeout
        );
    }
}
