package io.tasklane.kubernetes.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.tasklane.kubernetes.events.CloudEvent;
import io.tasklane.kubernetes.events.EventDeliveryException;
import io.tasklane.kubernetes.events.EventSink;
import io.tasklane.kubernetes.models.CloudEventDelivery;
import io.tasklane.kubernetes.models.CloudEventDeliveryState;
import io.tasklane.kubernetes.models.Condition;
import io.tasklane.kubernetes.models.ConditionStatus;
import io.tasklane.kubernetes.models.DeliveryStatus;
import io.tasklane.kubernetes.models.TaskRun;
import io.tasklane.kubernetes.models.TaskRunStatus;
import io.tasklane.kubernetes.serializers.JacksonMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;

/**
 * Sends one cloud event per pending delivery record of a run and keeps the record bookkeeping:
 * every attempt increments the retry count, a success marks the record {@code Sent} for good and
 * a record running out of attempts becomes {@code Failed}.
 */
@Slf4j
public class NotificationDispatcher {
    public static final String EVENT_SUCCESSFUL = "dev.tekton.event.task.successful";
    public static final String EVENT_FAILED = "dev.tekton.event.task.failed";
    public static final String EVENT_UNKNOWN = "dev.tekton.event.task.unknown";

    private final EventSink sink;
    private final int maxAttempts;
    private final Clock clock;

    public NotificationDispatcher(EventSink sink, int maxAttempts, Clock clock) {
        this.sink = sink;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.clock = clock;
    }

    /**
     * Adds an {@code Unknown} record with no attempt for every target that has none yet.
     *
     * @return whether a record was added
     */
    public static boolean initialize(TaskRunStatus status, Collection<String> targets) {
        boolean changed = false;

        for (String target : targets) {
            boolean known = status.cloudEventDeliveries()
                .stream()
                .anyMatch(delivery -> target.equals(delivery.getTarget()));

            if (!known) {
                status.cloudEventDeliveries().add(CloudEventDelivery.pending(target));
                changed = true;
            }
        }

        return changed;
    }

    /**
     * Attempts every record which is neither {@code Sent} nor {@code Failed}, once.
     *
     * @return whether a record was modified
     */
    public boolean dispatch(TaskRun run) {
        if (run.getStatus() == null || run.getStatus().getCloudEvents() == null) {
            return false;
        }

        boolean changed = false;

        for (CloudEventDelivery delivery : run.getStatus().getCloudEvents()) {
            if (!delivery.isPending()) {
                continue;
            }

            if (delivery.getStatus() == null) {
                delivery.setStatus(CloudEventDeliveryState.builder()
                    .condition(DeliveryStatus.UNKNOWN)
                    .message("")
                    .build()
                );
            }

            CloudEventDeliveryState state = delivery.getStatus();
            state.setRetryCount(state.getRetryCount() + 1);
            changed = true;

            try {
                sink.send(delivery.getTarget(), event(run));

                state.setCondition(DeliveryStatus.SENT);
                state.setMessage("");
                state.setSentAt(Instant.now(clock));

                log.debug("Cloud event for '{}' sent to '{}'", run.key(), delivery.getTarget());
            } catch (EventDeliveryException e) {
                state.setMessage(e.getMessage());

                if (state.getRetryCount() >= maxAttempts) {
                    state.setCondition(DeliveryStatus.FAILED);
                    log.warn("Cloud event for '{}' to '{}' failed after {} attempts: {}", run.key(), delivery.getTarget(), state.getRetryCount(), e.getMessage());
                } else {
                    log.debug("Cloud event for '{}' to '{}' failed (attempt {}): {}", run.key(), delivery.getTarget(), state.getRetryCount(), e.getMessage());
                }
            }
        }

        return changed;
    }

    public boolean hasPending(TaskRun run) {
        return run.getStatus() != null &&
            run.getStatus().getCloudEvents() != null &&
            run.getStatus().getCloudEvents().stream().anyMatch(CloudEventDelivery::isPending);
    }

    private CloudEvent event(TaskRun run) throws EventDeliveryException {
        byte[] data;
        try {
            data = JacksonMapper.ofJson().writeValueAsBytes(Map.of("taskRun", run));
        } catch (JsonProcessingException e) {
            throw new EventDeliveryException("Unable to serialize run '" + run.key() + "': " + e.getMessage(), e);
        }

        return CloudEvent.builder()
            .id(UUID.randomUUID().toString())
            .source(run.selfLink())
            .type(eventType(run))
            .time(Instant.now(clock))
            .data(data)
            .build();
    }

    static String eventType(TaskRun run) {
        ConditionStatus status = run.succeededCondition()
            .map(Condition::getStatus)
            .orElse(ConditionStatus.UNKNOWN);

        switch (status) {
            case TRUE:
                return EVENT_SUCCESSFUL;
            case FALSE:
                return EVENT_FAILED;
            default:
                return EVENT_UNKNOWN;
        }
    }
}
