package com.playlistchecker.core.queue;

/**
 * Contract für Komponenten, die QueueTasks verarbeiten können.
 */
@FunctionalInterface
public interface TaskExecutor {
    /**
     * Führt den Task aus. Eine Exception markiert den Task als FAILED.
     * @param task Handle mit Status und Fortschritt
     */
    void execute(QueueTask task) throws Exception;
}
