package io.tasklane.kubernetes.reconciler;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.tasklane.kubernetes.TestUtils;
import io.tasklane.kubernetes.config.ControllerConfig;
import io.tasklane.kubernetes.events.CloudEvent;
import io.tasklane.kubernetes.exceptions.ResolutionException;
import io.tasklane.kubernetes.models.Condition;
import io.tasklane.kubernetes.models.ConditionStatus;
import io.tasklane.kubernetes.models.DeliveryStatus;
import io.tasklane.kubernetes.models.PipelineResourceSpec;
import io.tasklane.kubernetes.models.Reason;
import io.tasklane.kubernetes.models.TaskRef;
import io.tasklane.kubernetes.models.TaskRun;
import io.tasklane.kubernetes.models.TaskRunSpec;
import io.tasklane.kubernetes.models.TaskSpec;
import io.tasklane.kubernetes.pod.EntrypointCache;
import io.tasklane.kubernetes.pod.TaskPodBuilder;
import io.tasklane.kubernetes.services.NotificationDispatcher;
import io.tasklane.kubernetes.services.ResultExtractor;
import io.tasklane.kubernetes.services.TimeoutHandler;
import io.tasklane.kubernetes.stores.PipelineResourceResolver;
import io.tasklane.kubernetes.stores.PodStore;
import io.tasklane.kubernetes.stores.PodStoreException;
import io.tasklane.kubernetes.stores.StoreException;
import io.tasklane.kubernetes.stores.TaskResolver;
import io.tasklane.kubernetes.stores.TaskRunStore;
import io.tasklane.kubernetes.utils.Names;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskRunReconcilerTest {
    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");
    private static final String KEY = "ci/build";
    private static final String POD = "build-pod-abcde";
    private static final String DIGEST = "sha256:" + "e".repeat(64);

    @Mock
    private TaskRunStore runs;

    @Mock
    private TaskResolver tasks;

    @Mock
    private PipelineResourceResolver resources;

    @Mock
    private PodStore pods;

    @Mock
    private EntrypointCache entrypoints;

    @Mock
    private TimeoutHandler timeouts;

    private final ControllerConfig config = ControllerConfig.builder().build();
    private final List<CloudEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() throws StoreException {
        lenient().when(runs.updateStatus(any(TaskRun.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void invalidKey() throws ReconcileException {
        assertThat(reconciler().reconcile("no-namespace"), is(ReconcileOutcome.DONE));

        verifyNoInteractions(runs, pods, timeouts);
    }

    @Test
    void deletedRun() throws Exception {
        when(runs.get("ci", "build")).thenReturn(Optional.empty());

        assertThat(reconciler().reconcile(KEY), is(ReconcileOutcome.DONE));

        verify(timeouts).release(KEY);
        verifyNoInteractions(pods);
    }

    @Test
    void storeError() throws Exception {
        when(runs.get("ci", "build")).thenThrow(new StoreException(StoreException.Kind.OTHER, "connection refused", null));

        assertThrows(ReconcileException.class, () -> reconciler().reconcile(KEY));
    }

    @Test
    void createPod() throws Exception {
        TaskRun run = givenRun("");
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of());
        when(pods.create(any(Pod.class))).thenAnswer(invocation -> invocation.getArgument(0));

        assertThat(reconciler().reconcile(KEY), is(ReconcileOutcome.DONE));

        assertThat(run.getStatus().getPodName(), is(POD));
        assertThat(run.getStatus().getStartTime(), is(NOW));
        assertCondition(run, ConditionStatus.UNKNOWN, Reason.PENDING, "Pending");
        assertThat(run.getStatus().getCompletionTime(), is(nullValue()));

        verify(runs, times(1)).updateStatus(run);
        verify(timeouts).setTimeout(KEY, Duration.ofHours(1));
    }

    @Test
    void quotaExceeded() throws Exception {
        TaskRun run = givenRun("");
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of());
        when(pods.create(any(Pod.class))).thenThrow(new PodStoreException(
            StoreException.Kind.FORBIDDEN,
            "pods \"" + POD + "\" is forbidden: exceeded quota: compute-resources"
        ));

        assertThat(reconciler().reconcile(KEY), is(ReconcileOutcome.REQUEUE));

        assertThat(run.isDone(), is(false));
        assertThat(run.getStatus().getPodName(), is(nullValue()));
        assertThat(run.succeededCondition().orElseThrow().getReason(), is(Reason.EXCEEDED_RESOURCE_QUOTA));
        assertThat(run.succeededCondition().orElseThrow().getStatus(), is(ConditionStatus.UNKNOWN));
        verify(timeouts, never()).setTimeout(anyString(), any(Duration.class));
    }

    @Test
    void forbiddenWithoutQuotaRequeued() throws Exception {
        TaskRun run = givenRun("");
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of());
        when(pods.create(any(Pod.class))).thenThrow(new PodStoreException(
            StoreException.Kind.FORBIDDEN,
            "pods \"" + POD + "\" is forbidden: unable to validate against any pod security policy"
        ));

        assertThat(reconciler().reconcile(KEY), is(ReconcileOutcome.REQUEUE));

        assertThat(run.succeededCondition().orElseThrow().getReason(), is(Reason.EXCEEDED_RESOURCE_QUOTA));
        assertThat(run.isDone(), is(false));
    }

    @Test
    void createFailure() throws Exception {
        TaskRun run = givenRun("");
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of());
        when(pods.create(any(Pod.class))).thenThrow(new PodStoreException(StoreException.Kind.OTHER, "admission webhook denied the request"));

        assertThat(reconciler().reconcile(KEY), is(ReconcileOutcome.DONE));

        assertThat(run.succeededCondition().orElseThrow().getReason(), is(Reason.COULDNT_GET_TASK));
        assertThat(run.succeededCondition().orElseThrow().getMessage(), startsWith("failed to create task run pod \"build\": "));
        assertThat(run.getStatus().getCompletionTime(), is(NOW));
        verify(timeouts).release(KEY);
    }

    @Test
    void taskNotFound() throws Exception {
        TaskRun run = givenRun("");
        when(tasks.resolve(eq("ci"), any(TaskRef.class))).thenThrow(new ResolutionException(
            ResolutionException.Kind.NOT_FOUND,
            "Task \"build-task\" not found in namespace \"ci\""
        ));

        assertThat(reconciler().reconcile(KEY), is(ReconcileOutcome.DONE));

        assertCondition(run, ConditionStatus.FALSE, Reason.FAILED_RESOLUTION, "Task \"build-task\" not found in namespace \"ci\"");
        verifyNoInteractions(pods);
    }

    @Test
    void missingParam() throws Exception {
        TaskRun run = givenRun("");
        when(tasks.resolve(eq("ci"), any(TaskRef.class))).thenReturn(TestUtils.read(TaskSpec.class, """
            inputs:
              params:
              - name: target
            steps:
            - name: compile
              image: golang
              command: ["go", "build"]
            """));
        when(pods.list("ci", "build")).thenReturn(List.of());

        reconciler().reconcile(KEY);

        assertCondition(run, ConditionStatus.FALSE, Reason.VALIDATION_FAILED, "missing value for param \"target\"");
        verify(pods, never()).create(any(Pod.class));
    }

    @Test
    void lookupError() throws Exception {
        givenRun("");
        givenTask();
        when(pods.list("ci", "build")).thenThrow(new PodStoreException(StoreException.Kind.OTHER, "timeout"));

        assertThrows(ReconcileException.class, () -> reconciler().reconcile(KEY));
        verify(runs, never()).updateStatus(any(TaskRun.class));
    }

    @Test
    void boundPodMissing() throws Exception {
        TaskRun run = givenRun("", started("Pending"));
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of());

        reconciler().reconcile(KEY);

        assertCondition(run, ConditionStatus.FALSE, Reason.FAILED, "pod \"" + POD + "\" not found");
        verify(pods, never()).create(any(Pod.class));
    }

    @Test
    void runningMarksReady() throws Exception {
        TaskRun run = givenRun("", started("Pending"));
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of(pod("Running", false, "")));

        assertThat(reconciler().reconcile(KEY), is(ReconcileOutcome.DONE));

        assertCondition(run, ConditionStatus.UNKNOWN, Reason.RUNNING, TaskRunReconciler.MESSAGE_RUNNING);
        assertThat(run.getStatus().getStartTime(), is(NOW.minusSeconds(300)));
        assertThat(run.getStatus().getSteps(), hasSize(2));
        assertThat(run.getStatus().getSteps().get(0).getName(), is("compile"));
        assertThat(run.getStatus().getSteps().get(1).getName(), is("image-digest-exporter-abcde"));
        verify(pods).markReady("ci", POD);
        verify(timeouts).setTimeout(KEY, Duration.ofMinutes(55));
    }

    @Test
    void markReadyFailure() throws Exception {
        givenRun("", started("Pending"));
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of(pod("Running", false, "")));
        doThrow(new PodStoreException(StoreException.Kind.CONFLICT, "conflict")).when(pods).markReady("ci", POD);

        assertThat(reconciler().reconcile(KEY), is(ReconcileOutcome.REQUEUE));
    }

    @Test
    void unchangedStatusNotPersisted() throws Exception {
        TaskRun run = givenRun("", started("Pending"));
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of(pod("Running", true, "")));

        reconciler().reconcile(KEY);
        Instant transition = run.succeededCondition().orElseThrow().getLastTransitionTime();

        reconciler(Clock.fixed(NOW.plusSeconds(60), ZoneOffset.UTC)).reconcile(KEY);

        verify(runs, times(1)).updateStatus(run);
        verify(pods, never()).markReady(anyString(), anyString());
        assertThat(run.getStatus().getStartTime(), is(NOW.minusSeconds(300)));
        assertThat(run.succeededCondition().orElseThrow().getLastTransitionTime(), is(transition));
    }

    @Test
    void succeededWithResults() throws Exception {
        TaskRun run = givenRun("", started("Running"));
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of(pod(
            "Succeeded",
            true,
            "[{\"name\":\"my-image\",\"digest\":\"" + DIGEST + "\"}]"
        )));

        assertThat(reconciler().reconcile(KEY), is(ReconcileOutcome.DONE));

        assertCondition(run, ConditionStatus.TRUE, Reason.SUCCEEDED, TaskRunReconciler.MESSAGE_SUCCEEDED);
        assertThat(run.getStatus().getCompletionTime(), is(NOW));
        assertThat(run.getStatus().getResourcesResult(), hasSize(1));
        assertThat(run.getStatus().getResourcesResult().get(0).getDigest(), is(DIGEST));
        verify(timeouts).release(KEY);
        verify(timeouts, never()).setTimeout(anyString(), any(Duration.class));
    }

    @Test
    void resultsFromLogs() throws Exception {
        TaskRun run = givenRun("", started("Running"));
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of(pod("Succeeded", true, "")));
        when(pods.containerLog("ci", POD, "step-image-digest-exporter-abcde"))
            .thenReturn("exporting\n[{\"name\":\"my-image\",\"digest\":\"" + DIGEST + "\"}]");

        reconciler().reconcile(KEY);

        assertThat(run.getStatus().getResourcesResult(), hasSize(1));
    }

    @Test
    void invalidResultsIgnored() throws Exception {
        TaskRun run = givenRun("", started("Running"));
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of(pod("Succeeded", true, "[{\"name\":\"my-image\"}]")));

        reconciler().reconcile(KEY);

        assertThat(run.getStatus().getResourcesResult(), is(nullValue()));
        assertThat(run.succeededCondition().orElseThrow().getStatus(), is(ConditionStatus.TRUE));
    }

    @Test
    void failed() throws Exception {
        TaskRun run = givenRun("", started("Running"));
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of(TestUtils.read(Pod.class, """
            metadata:
              name: build-pod-abcde
              namespace: ci
            spec:
              containers:
              - name: step-compile
                image: golang
            status:
              phase: Failed
              containerStatuses:
              - name: step-compile
                imageID: golang@sha256:1
                state:
                  terminated:
                    exitCode: 1
            """)));

        reconciler().reconcile(KEY);

        assertCondition(run, ConditionStatus.FALSE, Reason.FAILED,
            "\"step-compile\" exited with code 1 (image: \"golang@sha256:1\"); for logs run: kubectl -n ci logs build-pod-abcde -c step-compile"
        );
    }

    @Test
    void oomKilled() throws Exception {
        TaskRun run = givenRun("", started("Running"));
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of(TestUtils.read(Pod.class, """
            metadata:
              name: build-pod-abcde
              namespace: ci
            status:
              phase: Failed
              containerStatuses:
              - name: step-compile
                state:
                  terminated:
                    exitCode: 137
                    reason: OOMKilled
            """)));

        reconciler().reconcile(KEY);

        assertThat(run.succeededCondition().orElseThrow().getReason(), is(Reason.OOM_KILLED));
        assertThat(run.succeededCondition().orElseThrow().getStatus(), is(ConditionStatus.FALSE));
    }

    @Test
    void createContainerConfigError() throws Exception {
        TaskRun run = givenRun("", started("Pending"));
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of(TestUtils.read(Pod.class, """
            metadata:
              name: build-pod-abcde
              namespace: ci
            status:
              phase: Pending
              containerStatuses:
              - name: step-compile
                state:
                  waiting:
                    reason: CreateContainerConfigError
                    message: secret "creds" not found
            """)));

        reconciler().reconcile(KEY);

        assertCondition(run, ConditionStatus.FALSE, Reason.CREATE_CONTAINER_CONFIG_ERROR,
            "Failed to create pod due to config error: secret \"creds\" not found"
        );
    }

    @Test
    void exceededNodeResources() throws Exception {
        TaskRun run = givenRun("", started("Pending"));
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of(TestUtils.read(Pod.class, """
            metadata:
              name: build-pod-abcde
              namespace: ci
            status:
              phase: Pending
              conditions:
              - type: PodScheduled
                status: "False"
                reason: Unschedulable
                message: "0/3 nodes are available: 3 Insufficient memory."
            """)));

        reconciler().reconcile(KEY);

        assertCondition(run, ConditionStatus.UNKNOWN, Reason.EXCEEDED_NODE_RESOURCES,
            "TaskRun pod \"" + POD + "\" exceeded available resources"
        );
        assertThat(run.isDone(), is(false));
    }

    @Test
    void timeout() throws Exception {
        TaskRun run = givenRun("timeout: 1h", """
            podName: build-pod-abcde
            startTime: "2026-01-01T08:00:00Z"
            conditions:
            - type: Succeeded
              status: Unknown
              reason: Running
              lastTransitionTime: "2026-01-01T08:00:00Z"
            """);
        givenTask();

        assertThat(reconciler().reconcile(KEY), is(ReconcileOutcome.DONE));

        assertCondition(run, ConditionStatus.FALSE, Reason.TIMEOUT, "TaskRun \"build\" failed to finish within \"1h0m0s\"");
        assertThat(run.getStatus().getCompletionTime(), is(NOW));
        verify(pods).stop("ci", POD);
        verify(pods, never()).list(anyString(), anyString());
        verify(timeouts).release(KEY);
    }

    @Test
    void timeoutWithoutPod() throws Exception {
        TaskRun run = givenRun("timeout: 10s", """
            startTime: "2026-01-01T09:59:45Z"
            conditions:
            - type: Succeeded
              status: Unknown
              reason: Pending
              lastTransitionTime: "2026-01-01T09:59:45Z"
            """);
        givenTask();

        assertThat(reconciler().reconcile(KEY), is(ReconcileOutcome.DONE));

        assertCondition(run, ConditionStatus.FALSE, Reason.TIMEOUT, "TaskRun \"build\" failed to finish within \"10s\"");
        assertThat(run.getStatus().getPodName(), is(nullValue()));
        verifyNoInteractions(pods);
        verify(timeouts).release(KEY);
    }

    @Test
    void defaultTimeoutWithoutPod() throws Exception {
        TaskRun run = givenRun("", """
            startTime: "2026-01-01T08:59:00Z"
            conditions:
            - type: Succeeded
              status: Unknown
              reason: Pending
              lastTransitionTime: "2026-01-01T08:59:00Z"
            """);
        givenTask();

        reconciler().reconcile(KEY);

        assertCondition(run, ConditionStatus.FALSE, Reason.TIMEOUT, "TaskRun \"build\" failed to finish within \"1h0m0s\"");
        verifyNoInteractions(pods);
    }

    @Test
    void zeroTimeoutDisabled() throws Exception {
        TaskRun run = givenRun("timeout: 0s", """
            podName: build-pod-abcde
            startTime: "2025-12-01T00:00:00Z"
            """);
        givenTask();
        when(pods.list("ci", "build")).thenReturn(List.of(pod("Running", true, "")));

        reconciler().reconcile(KEY);

        assertThat(run.succeededCondition().orElseThrow().getReason(), is(Reason.RUNNING));
        verify(pods, never()).stop(anyString(), anyString());
        verify(timeouts, never()).setTimeout(anyString(), any(Duration.class));
    }

    @Test
    void cancelled() throws Exception {
        TaskRun run = givenRun("status: TaskRunCancelled", started("Running"));

        assertThat(reconciler().reconcile(KEY), is(ReconcileOutcome.DONE));

        assertCondition(run, ConditionStatus.FALSE, Reason.CANCELLED, "TaskRun \"build\" was cancelled");
        verify(pods).stop("ci", POD);
        verify(pods, never()).list(anyString(), anyString());
        verify(timeouts).release(KEY);
    }

    @Test
    void doneRunUntouched() throws Exception {
        TaskRun run = givenRun("", """
            podName: build-pod-abcde
            startTime: "2026-01-01T09:00:00Z"
            completionTime: "2026-01-01T09:10:00Z"
            conditions:
            - type: Succeeded
              status: "False"
              reason: Failed
              message: boom
              lastTransitionTime: "2026-01-01T09:10:00Z"
            """);

        assertThat(reconciler().reconcile(KEY), is(ReconcileOutcome.DONE));

        assertCondition(run, ConditionStatus.FALSE, Reason.FAILED, "boom");
        verify(runs, never()).updateStatus(any(TaskRun.class));
        verifyNoInteractions(pods, tasks);
        verify(timeouts).release(KEY);
    }

    @Test
    void cloudEventsSentOnCompletion() throws Exception {
        TaskRun run = givenRun("""
            outputs:
              resources:
              - name: notify
                resourceRef:
                  name: sink
            """, started("Running"));
        givenTask();
        when(resources.resolve("ci", "sink")).thenReturn(TestUtils.read(PipelineResourceSpec.class, """
            type: cloudEvent
            params:
            - name: TargetURI
              value: http://sink.ci.svc
            """));
        when(pods.list("ci", "build")).thenReturn(List.of(pod("Succeeded", true, "[]")));

        reconciler().reconcile(KEY);

        assertThat(events, hasSize(1));
        assertThat(events.get(0).getType(), is(NotificationDispatcher.EVENT_SUCCESSFUL));
        assertThat(run.getStatus().getCloudEvents(), hasSize(1));
        assertThat(run.getStatus().getCloudEvents().get(0).getTarget(), is("http://sink.ci.svc"));
        assertThat(run.getStatus().getCloudEvents().get(0).getStatus().getCondition(), is(DeliveryStatus.SENT));
        verify(runs, times(2)).updateStatus(run);
    }

    @Test
    void resume() {
        TaskRun run = TaskRun.builder()
            .metadata(new ObjectMetaBuilder().withNamespace("ci").withName("build").build())
            .spec(new TaskRunSpec())
            .build();

        reconciler().resume(run);
        verifyNoInteractions(timeouts);

        run.status().setStartTime(NOW.minusSeconds(600));
        reconciler().resume(run);
        verify(timeouts).setTimeout(KEY, Duration.ofMinutes(50));
    }

    private TaskRunReconciler reconciler() {
        return reconciler(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private TaskRunReconciler reconciler(Clock clock) {
        return TaskRunReconciler.builder()
            .config(config)
            .runs(runs)
            .tasks(tasks)
            .resources(resources)
            .pods(pods)
            .podBuilder(new TaskPodBuilder(config, entrypoints, Names.fixed("abcde")))
            .resultExtractor(new ResultExtractor())
            .timeouts(timeouts)
            .notifications(new NotificationDispatcher((target, event) -> events.add(event), 3, clock))
            .clock(clock)
            .build();
    }

    private TaskRun givenRun(String spec) throws Exception {
        return givenRun(spec, null);
    }

    private TaskRun givenRun(String spec, String status) throws Exception {
        StringBuilder yaml = new StringBuilder("""
            apiVersion: tekton.dev/v1alpha1
            kind: TaskRun
            metadata:
              name: build
              namespace: ci
              uid: 0000-1111
            spec:
              taskRef:
                name: build-task
            """);
        spec.lines().forEach(line -> yaml.append("  ").append(line).append("\n"));

        if (status != null) {
            yaml.append("status:\n");
            status.lines().forEach(line -> yaml.append("  ").append(line).append("\n"));
        }

        TaskRun run = TestUtils.read(TaskRun.class, yaml.toString());
        when(runs.get("ci", "build")).thenReturn(Optional.of(run));

        return run;
    }

    private static String started(String reason) {
        return """
            podName: build-pod-abcde
            startTime: "2026-01-01T09:55:00Z"
            conditions:
            - type: Succeeded
              status: Unknown
              reason: %s
              lastTransitionTime: "2026-01-01T09:55:00Z"
            """.formatted(reason);
    }

    private void givenTask() throws Exception {
        when(tasks.resolve(eq("ci"), any(TaskRef.class))).thenReturn(TestUtils.read(TaskSpec.class, """
            steps:
            - name: compile
              image: golang
              command: ["go", "build"]
            """));
    }

    private static Pod pod(String phase, boolean ready, String exporterMessage) throws Exception {
        return TestUtils.read(Pod.class, """
            metadata:
              name: build-pod-abcde
              namespace: ci
              labels:
                tekton.dev/taskRun: build
              annotations:
                tekton.dev/ready: "%s"
            spec:
              containers:
              - name: step-compile
                image: golang
              - name: step-image-digest-exporter-abcde
                image: exporter
            status:
              phase: %s
              containerStatuses:
              - name: step-compile
                imageID: golang@sha256:1
                state:
                  running:
                    startedAt: "2026-01-01T09:56:00Z"
              - name: step-image-digest-exporter-abcde
                imageID: exporter@sha256:2
                state:
                  terminated:
                    exitCode: 0
                    message: '%s'
            """.formatted(ready ? "READY" : "", phase, exporterMessage));
    }

    private static void assertCondition(TaskRun run, ConditionStatus status, Reason reason, String message) {
        Condition condition = run.succeededCondition().orElseThrow();

        assertThat(condition.getStatus(), is(status));
        assertThat(condition.getReason(), is(reason));
        assertThat(condition.getMessage(), is(message));
        assertThat(condition.getLastTransitionTime(), is(notNullValue()));
    }
}
