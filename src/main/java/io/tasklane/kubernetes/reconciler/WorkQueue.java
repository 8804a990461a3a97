package io.tasklane.kubernetes.reconciler;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO of run keys where a key is queued at most once and handed to at most one worker at a time.
 * A key added while a worker holds it is queued again when the worker calls {@link #done(String)}.
 */
@Slf4j
public class WorkQueue {
    private final Lock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();

    private final Deque<String> queue = new ArrayDeque<>();
    private final Set<String> dirty = new HashSet<>();
    private final Set<String> processing = new HashSet<>();
    private final Map<String, Integer> failures = new HashMap<>();

    private final ScheduledExecutorService delayed;
    private final Duration baseDelay;
    private final Duration maxDelay;

    private boolean shuttingDown = false;

    public WorkQueue(Duration baseDelay, Duration maxDelay) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.delayed = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
            .setNameFormat("workqueue-delay-%d")
            .setDaemon(true)
            .build()
        );
    }

    public void add(String key) {
        lock.lock();
        try {
            if (shuttingDown || dirty.contains(key)) {
                return;
            }

            dirty.add(key);
            if (processing.contains(key)) {
                return;
            }

            queue.addLast(key);
            available.signal();
        } finally {
            lock.unlock();
        }
    }

    public void addAfter(String key, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            this.add(key);
            return;
        }

        lock.lock();
        try {
            if (shuttingDown) {
                return;
            }

            delayed.schedule(() -> this.add(key), delay.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds the key after a delay doubling with every consecutive failure, until {@link #forget(String)}.
     */
    public void addRateLimited(String key) {
        int attempts;

        lock.lock();
        try {
            attempts = failures.merge(key, 1, Integer::sum);
        } finally {
            lock.unlock();
        }

        Duration delay = this.backoff(attempts);
        log.debug("Requeue '{}' in {} (attempt {})", key, delay, attempts);

        this.addAfter(key, delay);
    }

    public void forget(String key) {
        lock.lock();
        try {
            failures.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public int numRequeues(String key) {
        lock.lock();
        try {
            return failures.getOrDefault(key, 0);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a key is available.
     *
     * @return the key, or {@code null} once the queue is shut down
     */
    public String take() throws InterruptedException {
        lock.lock();
        try {
            while (queue.isEmpty() && !shuttingDown) {
                available.await();
            }

            if (shuttingDown) {
                return null;
            }

            String key = queue.pollFirst();
            processing.add(key);
            dirty.remove(key);

            return key;
        } finally {
            lock.unlock();
        }
    }

    public void done(String key) {
        lock.lock();
        try {
            processing.remove(key);

            if (dirty.contains(key) && !shuttingDown) {
                queue.addLast(key);
                available.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public void shutdown() {
        lock.lock();
        try {
            shuttingDown = true;
            available.signalAll();
        } finally {
            lock.unlock();
        }

        delayed.shutdownNow();
    }

    Duration backoff(int attempts) {
        long multiplier = 1L << Math.min(Math.max(attempts - 1, 0), 30);
        Duration delay = baseDelay.multipliedBy(multiplier);

        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
