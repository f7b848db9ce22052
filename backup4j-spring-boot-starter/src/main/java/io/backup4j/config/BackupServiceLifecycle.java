package io.backup4j.config;

import io.backup4j.BackupService;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the backup server start/stop lifecycle with the Spring container lifecycle.
 */
public class BackupServiceLifecycle implements SmartLifecycle {
    private final BackupService backupService;
    private volatile boolean running = false;

    public BackupServiceLifecycle(BackupService backupService) {
        this.backupService = backupService;
    }

    @Override
    public void start() {
        backupService.start();
        running = true;
    }

    @Override
    public void stop() {
        backupService.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
