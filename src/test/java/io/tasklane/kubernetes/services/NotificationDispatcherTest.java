package io.tasklane.kubernetes.services;

import com.fasterxml.jackson.databind.JsonNode;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.tasklane.kubernetes.events.CloudEvent;
import io.tasklane.kubernetes.events.EventDeliveryException;
import io.tasklane.kubernetes.models.CloudEventDelivery;
import io.tasklane.kubernetes.models.Condition;
import io.tasklane.kubernetes.models.ConditionStatus;
import io.tasklane.kubernetes.models.DeliveryStatus;
import io.tasklane.kubernetes.models.Reason;
import io.tasklane.kubernetes.models.TaskRun;
import io.tasklane.kubernetes.models.TaskRunStatus;
import io.tasklane.kubernetes.serializers.JacksonMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

class NotificationDispatcherTest {
    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private final List<CloudEvent> sent = new ArrayList<>();

    @Test
    void initializeOnce() {
        TaskRunStatus status = new TaskRunStatus();

        assertThat(NotificationDispatcher.initialize(status, List.of("http://sink-a", "http://sink-b")), is(true));
        assertThat(NotificationDispatcher.initialize(status, List.of("http://sink-a")), is(false));

        assertThat(status.getCloudEvents(), hasSize(2));
        assertThat(status.getCloudEvents().get(0).getStatus().getCondition(), is(DeliveryStatus.UNKNOWN));
        assertThat(status.getCloudEvents().get(0).getStatus().getRetryCount(), is(0));
    }

    @Test
    void sent() throws Exception {
        NotificationDispatcher dispatcher = new NotificationDispatcher((target, event) -> sent.add(event), 3, Clock.fixed(NOW, ZoneOffset.UTC));
        TaskRun run = run(ConditionStatus.TRUE, Reason.SUCCEEDED, "http://sink");

        assertThat(dispatcher.dispatch(run), is(true));

        CloudEventDelivery delivery = run.getStatus().getCloudEvents().get(0);
        assertThat(delivery.getStatus().getCondition(), is(DeliveryStatus.SENT));
        assertThat(delivery.getStatus().getRetryCount(), is(1));
        assertThat(delivery.getStatus().getSentAt(), is(NOW));

        assertThat(sent, hasSize(1));
        assertThat(sent.get(0).getType(), is(NotificationDispatcher.EVENT_SUCCESSFUL));
        assertThat(sent.get(0).getSource(), is("/apis/tekton.dev/v1alpha1/namespaces/default/taskruns/build"));

        JsonNode data = JacksonMapper.ofJson().readTree(sent.get(0).getData());
        assertThat(data.at("/taskRun/metadata/name").asText(), is("build"));

        // nothing left to send
        assertThat(dispatcher.dispatch(run), is(false));
        assertThat(sent, hasSize(1));
    }

    @Test
    void failedAfterMaxAttempts() {
        NotificationDispatcher dispatcher = new NotificationDispatcher(
            (target, event) -> {
                throw new EventDeliveryException("connection refused");
            },
            2,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
        TaskRun run = run(ConditionStatus.FALSE, Reason.FAILED, "http://sink");
        CloudEventDelivery delivery = run.getStatus().getCloudEvents().get(0);

        assertThat(dispatcher.dispatch(run), is(true));
        assertThat(delivery.getStatus().getCondition(), is(DeliveryStatus.UNKNOWN));
        assertThat(delivery.getStatus().getMessage(), is("connection refused"));
        assertThat(dispatcher.hasPending(run), is(true));

        assertThat(dispatcher.dispatch(run), is(true));
        assertThat(delivery.getStatus().getCondition(), is(DeliveryStatus.FAILED));
        assertThat(delivery.getStatus().getRetryCount(), is(2));
        assertThat(dispatcher.hasPending(run), is(false));

        assertThat(dispatcher.dispatch(run), is(false));
    }

    @Test
    void everyRecordSent() {
        NotificationDispatcher dispatcher = new NotificationDispatcher((target, event) -> sent.add(event), 3, Clock.fixed(NOW, ZoneOffset.UTC));
        TaskRun run = run(ConditionStatus.TRUE, Reason.SUCCEEDED, "http://sink-a", "http://sink-b");

        assertThat(dispatcher.dispatch(run), is(true));

        for (CloudEventDelivery delivery : run.getStatus().getCloudEvents()) {
            assertThat(delivery.getStatus().getCondition(), is(DeliveryStatus.SENT));
            assertThat(delivery.getStatus().getRetryCount(), is(1));
            assertThat(delivery.getStatus().getMessage(), is(""));
        }
        assertThat(sent, hasSize(2));
    }

    @Test
    void failureDoesNotBlockOtherRecords() {
        List<String> targets = new ArrayList<>();
        NotificationDispatcher dispatcher = new NotificationDispatcher(
            (target, event) -> {
                targets.add(target);
                if (target.equals("http://sink-a")) {
                    throw new EventDeliveryException("connection refused");
                }
            },
            3,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
        TaskRun run = run(ConditionStatus.FALSE, Reason.FAILED, "http://sink-a", "http://sink-b");
        CloudEventDelivery failing = run.getStatus().getCloudEvents().get(0);
        CloudEventDelivery working = run.getStatus().getCloudEvents().get(1);

        assertThat(dispatcher.dispatch(run), is(true));

        assertThat(failing.getStatus().getCondition(), is(DeliveryStatus.UNKNOWN));
        assertThat(failing.getStatus().getRetryCount(), is(1));
        assertThat(failing.getStatus().getMessage(), is("connection refused"));
        assertThat(working.getStatus().getCondition(), is(DeliveryStatus.SENT));
        assertThat(working.getStatus().getRetryCount(), is(1));
        assertThat(working.getStatus().getSentAt(), is(NOW));

        assertThat(dispatcher.dispatch(run), is(true));

        assertThat(failing.getStatus().getRetryCount(), is(2));
        assertThat(working.getStatus().getCondition(), is(DeliveryStatus.SENT));
        assertThat(working.getStatus().getRetryCount(), is(1));
        assertThat(targets, contains("http://sink-a", "http://sink-b", "http://sink-a"));
    }

    @Test
    void eventType() {
        assertThat(NotificationDispatcher.eventType(run(ConditionStatus.TRUE, Reason.SUCCEEDED)), is(NotificationDispatcher.EVENT_SUCCESSFUL));
        assertThat(NotificationDispatcher.eventType(run(ConditionStatus.FALSE, Reason.TIMEOUT)), is(NotificationDispatcher.EVENT_FAILED));
        assertThat(NotificationDispatcher.eventType(run(ConditionStatus.UNKNOWN, Reason.RUNNING)), is(NotificationDispatcher.EVENT_UNKNOWN));
    }

    private static TaskRun run(ConditionStatus status, Reason reason, String... targets) {
        TaskRun run = TaskRun.builder()
            .apiVersion(TaskRun.API_VERSION)
            .kind(TaskRun.KIND)
            .metadata(new ObjectMetaBuilder().withNamespace("default").withName("build").build())
            .build();

        run.status().setSucceededCondition(Condition.succeeded(status, reason, "message", NOW));
        NotificationDispatcher.initialize(run.status(), List.of(targets));

        return run;
    }
}
