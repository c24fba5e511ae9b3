package com.playlistchecker.core.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool for playlist tasks.
 * <p>
 * At most {@code capacity} tasks run at once. {@link #submit} blocks while all slots are taken,
 * so the number of outstanding tasks (and open connections) never exceeds the capacity.
 * Every submitted task is tracked until {@link #awaitAll()} has seen it finish.
 */
public class QueueManager {
    private static final Logger logger = LoggerFactory.getLogger(QueueManager.class);

    private final int capacity;
    private final Semaphore slots;
    private final ExecutorService workers;
    private final List<Submitted> submitted = new ArrayList<>();

    private record Submitted(QueueTask task, Future<?> future) {}

    public QueueManager(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be at least 1, was " + capacity);
        this.capacity = capacity;
        this.slots = new Semaphore(capacity, true);
        this.workers = Executors.newFixedThreadPool(capacity, new WorkerThreadFactory());
    }

    /**
     * Schedules {@code executor} for {@code task}, waiting for a free slot first.
     *
     * @throws InterruptedException if interrupted while waiting for a slot
     */
    public Future<?> submit(QueueTask task, TaskExecutor executor) throws InterruptedException {
        if (slots.availablePermits() == 0) {
            logger.debug("Pool saturated ({} running), waiting to submit {}", capacity, task.getName());
        }
        slots.acquire();
        try {
            Future<?> future = workers.submit(() -> runTask(task, executor));
            synchronized (submitted) {
                submitted.add(new Submitted(task, future));
            }
            logger.debug("Task submitted: {} ({})", task.getName(), task.getId());
            return future;
        } catch (RuntimeException e) {
            slots.release();
            throw e;
        }
    }

    private void runTask(QueueTask task, TaskExecutor executor) {
        try {
            task.setStatus(QueueTask.Status.RUNNING);
            logger.debug("Executing task {} on {}", task.getName(), Thread.currentThread().getName());

            executor.execute(task);

            if (task.getStatus() != QueueTask.Status.FAILED) {
                task.setStatus(QueueTask.Status.DONE);
            }
        } catch (Exception e) {
            logger.error("Error executing task '{}': {}", task.getName(), e.getMessage(), e);
            task.fail(e);
        } catch (Error e) {
            task.fail(e);
            throw e;
        } finally {
            slots.release();
        }
    }

    /**
     * Waits until every task submitted so far has finished and returns them in submission order.
     */
    public List<QueueTask> awaitAll() throws InterruptedException {
        List<Submitted> snapshot;
        synchronized (submitted) {
            snapshot = new ArrayList<>(submitted);
        }

        List<QueueTask> tasks = new ArrayList<>(snapshot.size());
        for (Submitted s : snapshot) {
            try {
                s.future().get();
            } catch (ExecutionException e) {
                // runTask fängt Exceptions selbst, hier landen nur Errors
                if (s.task().getStatus() != QueueTask.Status.FAILED) s.task().fail(e.getCause());
            }
            tasks.add(s.task());
        }
        return tasks;
    }

    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Worker pool did not terminate in time, forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "Pipe-Worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
