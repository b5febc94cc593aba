package com.liquidity.backend.service.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedList;
import java.util.ListIterator;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded-concurrency work queue. Highest priority runs first, equal priorities in insertion order.
 * A failed item goes back to the head of the queue after a backoff delay until its own retry budget
 * is spent; the caller's future completes with the last failure after that.
 */
@Slf4j
public class PriorityWorkQueue {

    public static final int DEFAULT_PRIORITY = 0;
    public static final String DEFAULT_CONTEXT = "api-call";

    private final int concurrentLimit;
    private final RetryPolicy backoff;
    private final Executor workerExecutor;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final Object lock = new Object();
    // guarded by lock
    private final LinkedList<QueueItem<?>> pending = new LinkedList<>();
    private final AtomicInteger activeRequests = new AtomicInteger();

    public PriorityWorkQueue(int concurrentLimit, RetryPolicy backoff, Executor workerExecutor,
                             TaskScheduler scheduler, Clock clock) {
        if (concurrentLimit <= 0) {
            throw new IllegalArgumentException("concurrentLimit must be positive");
        }
        this.concurrentLimit = concurrentLimit;
        this.backoff = backoff;
        this.workerExecutor = workerExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public <T> CompletableFuture<T> enqueue(Callable<T> operation) {
        return enqueue(operation, DEFAULT_PRIORITY, DEFAULT_CONTEXT, backoff.maxRetries());
    }

    public <T> CompletableFuture<T> enqueue(Callable<T> operation, int priority, String context) {
        return enqueue(operation, priority, context, backoff.maxRetries());
    }

    public <T> CompletableFuture<T> enqueue(Callable<T> operation, int priority, String context, int maxRetries) {
        QueueItem<T> item = new QueueItem<>(UUID.randomUUID().toString(), operation, priority,
                context == null ? DEFAULT_CONTEXT : context, Math.max(0, maxRetries), clock.instant());
        synchronized (lock) {
            insertByPriority(item);
        }
        dispatch();
        return item.future;
    }

    public QueueStats getStats() {
        synchronized (lock) {
            int active = activeRequests.get();
            return new QueueStats(pending.size(), active, active > 0);
        }
    }

    public int getQueueDepth() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public int getActiveRequests() {
        return activeRequests.get();
    }

    private void insertByPriority(QueueItem<?> item) {
        ListIterator<QueueItem<?>> iterator = pending.listIterator();
        while (iterator.hasNext()) {
            if (iterator.next().priority < item.priority) {
                iterator.previous();
                break;
            }
        }
        iterator.add(item);
    }

    private void dispatch() {
        while (true) {
            QueueItem<?> item;
            synchronized (lock) {
                if (pending.isEmpty() || activeRequests.get() >= concurrentLimit) {
                    return;
                }
                item = pending.removeFirst();
                activeRequests.incrementAndGet();
            }
            try {
                workerExecutor.execute(() -> process(item));
            } catch (RejectedExecutionException e) {
                activeRequests.decrementAndGet();
                log.error("Work queue rejected item id={} context={}", item.id, item.context, e);
                item.future.completeExceptionally(e);
            }
        }
    }

    private <T> void process(QueueItem<T> item) {
        try {
            T result = item.operation.call();
            item.future.complete(result);
        } catch (Exception e) {
            handleFailure(item, e);
        } catch (Throwable t) {
            // errors are not retried
            log.error("Queue item aborted id={} context={}", item.id, item.context, t);
            item.future.completeExceptionally(t);
        } finally {
            activeRequests.decrementAndGet();
            dispatch();
        }
    }

    private void handleFailure(QueueItem<?> item, Exception error) {
        if (item.retries >= item.maxRetries) {
            log.warn("Queue item failed id={} context={} attempts={} error={}",
                    item.id, item.context, item.retries + 1, error.getMessage());
            item.future.completeExceptionally(error);
            return;
        }
        Duration delay = backoff.delayForAttempt(item.retries);
        item.retries++;
        log.info("Rescheduling queue item id={} context={} retry={} delay={}ms",
                item.id, item.context, item.retries, delay.toMillis());
        scheduler.schedule(() -> {
            synchronized (lock) {
                pending.addFirst(item);
            }
            dispatch();
        }, clock.instant().plus(delay));
    }

    private static final class QueueItem<T> {
        private final String id;
        private final Callable<T> operation;
        private final int priority;
        private final String context;
        private final int maxRetries;
        private final Instant createdAt;
        private final CompletableFuture<T> future = new CompletableFuture<>();
        private int retries;

        private QueueItem(String id, Callable<T> operation, int priority, String context, int maxRetries,
                          Instant createdAt) {
            this.id = id;
            this.operation = operation;
            this.priority = priority;
            this.context = context;
            this.maxRetries = maxRetries;
            this.createdAt = createdAt;
        }

        @Override
        public String toString() {
            return "QueueItem[" + id + ", " + context + ", priority=" + priority + ", createdAt=" + createdAt + "]";
        }
    }
}
