package io.tasklane.kubernetes.stores;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.tasklane.kubernetes.TestUtils;
import io.tasklane.kubernetes.models.ConditionStatus;
import io.tasklane.kubernetes.models.Reason;
import io.tasklane.kubernetes.models.TaskRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KubernetesTaskRunStoreTest {
    private static final String RUN = """
        apiVersion: tekton.dev/v1alpha1
        kind: TaskRun
        metadata:
          name: build
          namespace: ci
          resourceVersion: "42"
        spec:
          taskRef:
            name: build-task
          timeout: 1h30m
          inputs:
            params:
            - name: flags
              value: ["-v", "-race"]
        status:
          podName: build-pod-abcde
          startTime: "2026-01-01T09:00:00Z"
          conditions:
          - type: Succeeded
            status: Unknown
            reason: Running
            lastTransitionTime: "2026-01-01T09:00:05Z"
        """;

    @Mock
    private KubernetesClient client;

    @Mock
    private MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> operation;

    @Mock
    private NonNamespaceOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> namespaced;

    @Mock
    private Resource<GenericKubernetesResource> resource;

    @BeforeEach
    void setUp() {
        when(client.genericKubernetesResources(TaskRun.API_VERSION, TaskRun.KIND)).thenReturn(operation);
        when(operation.inNamespace("ci")).thenReturn(namespaced);
    }

    @Test
    void get() throws Exception {
        when(namespaced.withName("build")).thenReturn(resource);
        when(resource.get()).thenReturn(TestUtils.read(GenericKubernetesResource.class, RUN));

        TaskRun run = new KubernetesTaskRunStore(client).get("ci", "build").orElseThrow();

        assertThat(run.key(), is("ci/build"));
        assertThat(run.getSpec().getTaskRef().getName(), is("build-task"));
        assertThat(run.getSpec().getTimeout(), is(Duration.ofMinutes(90)));
        assertThat(run.getSpec().params().get(0).getValue().getArrayVal().size(), is(2));
        assertThat(run.getStatus().getStartTime(), is(Instant.parse("2026-01-01T09:00:00Z")));
        assertThat(run.succeededCondition().orElseThrow().getStatus(), is(ConditionStatus.UNKNOWN));
        assertThat(run.succeededCondition().orElseThrow().getReason(), is(Reason.RUNNING));
        assertThat(run.isDone(), is(false));
    }

    @Test
    void notFound() throws Exception {
        when(namespaced.withName("build")).thenReturn(resource);
        when(resource.get()).thenReturn(null);

        Optional<TaskRun> run = new KubernetesTaskRunStore(client).get("ci", "build");

        assertThat(run.isPresent(), is(false));
    }

    @Test
    void getForbidden() {
        when(namespaced.withName("build")).thenReturn(resource);
        when(resource.get()).thenThrow(new KubernetesClientException("taskruns is forbidden", 403, null));

        StoreException exception = assertThrows(StoreException.class, () -> new KubernetesTaskRunStore(client).get("ci", "build"));

        assertThat(exception.getKind(), is(StoreException.Kind.FORBIDDEN));
    }

    @Test
    @SuppressWarnings("unchecked")
    void updateStatus() throws Exception {
        TaskRun run = TestUtils.read(TaskRun.class, RUN);
        run.getStatus().setCompletionTime(Instant.parse("2026-01-01T09:30:00Z"));

        ArgumentCaptor<GenericKubernetesResource> sent = ArgumentCaptor.forClass(GenericKubernetesResource.class);
        when(namespaced.resource(sent.capture())).thenReturn(resource);
        when(resource.updateStatus()).thenReturn(TestUtils.read(GenericKubernetesResource.class, RUN));

        TaskRun updated = new KubernetesTaskRunStore(client).updateStatus(run);

        Map<String, Object> status = (Map<String, Object>) sent.getValue().getAdditionalProperties().get("status");
        assertThat((String) status.get("podName"), is("build-pod-abcde"));
        assertThat((String) status.get("completionTime"), is("2026-01-01T09:30:00Z"));
        assertThat(sent.getValue().getMetadata().getResourceVersion(), is("42"));
        assertThat(updated.getStatus().getPodName(), is("build-pod-abcde"));
    }

    @Test
    void updateStatusConflict() throws Exception {
        TaskRun run = TestUtils.read(TaskRun.class, RUN);

        when(namespaced.resource(any(GenericKubernetesResource.class))).thenReturn(resource);
        when(resource.updateStatus()).thenThrow(new KubernetesClientException("the object has been modified", 409, null));

        StoreException exception = assertThrows(StoreException.class, () -> new KubernetesTaskRunStore(client).updateStatus(run));

        assertThat(exception.getKind(), is(StoreException.Kind.CONFLICT));
    }
}
