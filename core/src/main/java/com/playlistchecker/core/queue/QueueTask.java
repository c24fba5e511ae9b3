package com.playlistchecker.core.queue;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handle für einen Playlist-Task im Worker-Pool.
 */
public class QueueTask {
    public enum Status { WAITING, RUNNING, DONE, FAILED }

    private final String id;
    private final String name;
    private volatile Status status;
    private volatile Throwable error;

    private volatile int totalItems = 0;
    private final AtomicInteger processedItems = new AtomicInteger();

    public QueueTask(String name) {
        this.id = UUID.randomUUID().toString();
        this.name = name;
        this.status = Status.WAITING;
    }

    public void fail(Throwable cause) {
        this.error = cause;
        this.status = Status.FAILED;
    }

    // Getters & Setters
    public String getId() { return id; }
    public String getName() { return name; }
    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }
    public Throwable getError() { return error; }
    public void setTotalItems(int t) { this.totalItems = t; }
    public int getTotalItems() { return totalItems; }
    public int incrementProcessed() { return processedItems.incrementAndGet(); }
    public int getProcessedItems() { return processedItems.get(); }

    @Override
    public String toString() {
        return String.format("[%s] %s (%d/%d)", status, name, getProcessedItems(), totalItems);
    }
}
