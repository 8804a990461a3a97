package io.tasklane.kubernetes.watchers;

import io.fabric8.kubernetes.client.WatcherException;
import org.slf4j.Logger;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Turns watch events into run keys handed to the work queue.
 */
abstract public class AbstractWatch<T> implements io.fabric8.kubernetes.client.Watcher<T> {
    protected final Logger logger;
    private final Consumer<String> enqueue;
    private final Runnable onFailure;

    public AbstractWatch(Logger logger, Consumer<String> enqueue, Runnable onFailure) {
        this.logger = logger;
        this.enqueue = enqueue;
        this.onFailure = onFailure;
    }

    public void eventReceived(Action action, T resource) {
        logger.trace("Received action '{}' on [{}]", action, this.logContext(resource));

        if (action == Action.ERROR || action == Action.BOOKMARK) {
            return;
        }

        this.keyOf(resource).ifPresent(enqueue);
    }

    public void onClose() {
        logger.debug("Received close on [Type: {}]", this.getClass().getSimpleName());
    }

    public void onClose(WatcherException e) {
        logger.debug("Received close on [Type: {}] with exception", this.getClass().getSimpleName());

        if (e != null) {
            logger.error(e.getMessage(), e);
        }

        if (onFailure != null) {
            onFailure.run();
        }
    }

    abstract protected String logContext(T resource);

    abstract protected Optional<String> keyOf(T resource);
}
