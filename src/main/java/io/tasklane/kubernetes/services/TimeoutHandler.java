package io.tasklane.kubernetes.services;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * One cancellable deadline per run key. Firing only hands the key to a callback, usually the
 * work queue, it never touches the run itself.
 */
@Slf4j
public class TimeoutHandler {
    private final ScheduledExecutorService scheduler;
    private final ConcurrentHashMap<String, Armed> timers = new ConcurrentHashMap<>();
    private volatile Consumer<String> callback;

    public TimeoutHandler(Consumer<String> callback) {
        this(
            Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("taskrun-timeout-%d")
                .setDaemon(true)
                .build()
            ),
            callback
        );
    }

    public TimeoutHandler(ScheduledExecutorService scheduler, Consumer<String> callback) {
        this.scheduler = scheduler;
        this.callback = callback;
    }

    /**
     * Rebinds the default callback, {@code null} makes firing a no-op.
     */
    public void setCallback(Consumer<String> callback) {
        this.callback = callback;
    }

    public void setTimeout(String key, Duration duration) {
        this.setTimeout(key, duration, null);
    }

    /**
     * Arms the deadline of {@code key}, replacing any previous one which will then never fire.
     *
     * @param onExpire called instead of the default callback when given
     */
    public void setTimeout(String key, Duration duration, Consumer<String> onExpire) {
        Armed armed = new Armed(onExpire);
        Armed previous = timers.put(key, armed);

        if (previous != null) {
            previous.cancel();
        }

        long delay = Math.max(0, duration.toMillis());
        armed.future = scheduler.schedule(() -> this.fire(key, armed), delay, TimeUnit.MILLISECONDS);

        log.debug("Timeout armed for '{}' in {}", key, duration);
    }

    public void release(String key) {
        Armed armed = timers.remove(key);

        if (armed != null) {
            armed.cancel();
            log.debug("Timeout released for '{}'", key);
        }
    }

    public boolean isArmed(String key) {
        return timers.containsKey(key);
    }

    public void shutdown() {
        timers.values().forEach(Armed::cancel);
        timers.clear();
        scheduler.shutdownNow();
    }

    private void fire(String key, Armed armed) {
        if (!timers.remove(key, armed)) {
            return;
        }

        Consumer<String> target = armed.onExpire != null ? armed.onExpire : callback;
        if (target == null) {
            log.debug("Timeout expired for '{}' without callback", key);
            return;
        }

        log.debug("Timeout expired for '{}'", key);

        try {
            target.accept(key);
        } catch (RuntimeException e) {
            log.warn("Timeout callback failed for '{}'", key, e);
        }
    }

    private static class Armed {
        private final Consumer<String> onExpire;
        private volatile ScheduledFuture<?> future;

        private Armed(Consumer<String> onExpire) {
            this.onExpire = onExpire;
        }

        private void cancel() {
            ScheduledFuture<?> current = future;

            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
