package io.tasklane.kubernetes;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.Watch;
import io.tasklane.kubernetes.config.ControllerConfig;
import io.tasklane.kubernetes.events.HttpEventSink;
import io.tasklane.kubernetes.models.TaskRun;
import io.tasklane.kubernetes.pod.RegistryEntrypointCache;
import io.tasklane.kubernetes.pod.TaskPodBuilder;
import io.tasklane.kubernetes.reconciler.ReconcileException;
import io.tasklane.kubernetes.reconciler.ReconcileOutcome;
import io.tasklane.kubernetes.reconciler.TaskRunReconciler;
import io.tasklane.kubernetes.reconciler.WorkQueue;
import io.tasklane.kubernetes.registry.HttpImageRegistry;
import io.tasklane.kubernetes.registry.ServiceAccountCredentialResolver;
import io.tasklane.kubernetes.services.ClientService;
import io.tasklane.kubernetes.services.NotificationDispatcher;
import io.tasklane.kubernetes.services.ResultExtractor;
import io.tasklane.kubernetes.services.TimeoutHandler;
import io.tasklane.kubernetes.stores.KubernetesPodStore;
import io.tasklane.kubernetes.stores.KubernetesResourceLister;
import io.tasklane.kubernetes.stores.KubernetesTaskRunStore;
import io.tasklane.kubernetes.stores.StoreException;
import io.tasklane.kubernetes.stores.TaskRunStore;
import io.tasklane.kubernetes.utils.Names;
import io.tasklane.kubernetes.watchers.PodWatcher;
import io.tasklane.kubernetes.watchers.TaskRunWatcher;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs the reconciler over a pool of workers fed by the work queue. Keys come from the pod and run
 * watches, from expired timeouts and from failed passes requeued with backoff.
 */
@Slf4j
public class TaskRunController implements AutoCloseable {
    private final ControllerConfig config;
    private final TaskRunReconciler reconciler;
    private final TaskRunStore runs;
    private final WorkQueue queue;
    private final TimeoutHandler timeouts;
    private final KubernetesClient client;

    private final List<Watch> watches = new ArrayList<>();
    private ExecutorService workers;
    private volatile boolean running = false;

    public TaskRunController(
        ControllerConfig config,
        TaskRunReconciler reconciler,
        TaskRunStore runs,
        WorkQueue queue,
        TimeoutHandler timeouts,
        KubernetesClient client
    ) {
        this.config = config;
        this.reconciler = reconciler;
        this.runs = runs;
        this.queue = queue;
        this.timeouts = timeouts;
        this.client = client;
    }

    public static TaskRunController create(ControllerConfig config) {
        KubernetesClient client = ClientService.of(config.getConnection());

        WorkQueue queue = new WorkQueue(config.getRequeueBaseDelay(), config.getRequeueMaxDelay());
        TimeoutHandler timeouts = new TimeoutHandler(queue::add);
        KubernetesTaskRunStore runs = new KubernetesTaskRunStore(client);
        KubernetesResourceLister lister = new KubernetesResourceLister(client);

        RegistryEntrypointCache entrypoints = new RegistryEntrypointCache(
            new HttpImageRegistry(config.getRegistry().getTimeout(), config.getRegistry().getInsecureRegistries()),
            new ServiceAccountCredentialResolver(client)
        );

        TaskRunReconciler reconciler = TaskRunReconciler.builder()
            .config(config)
            .runs(runs)
            .tasks(lister)
            .resources(lister)
            .pods(new KubernetesPodStore(client))
            .podBuilder(new TaskPodBuilder(config, entrypoints, Names.random()))
            .resultExtractor(new ResultExtractor())
            .timeouts(timeouts)
            .notifications(new NotificationDispatcher(
                new HttpEventSink(config.getNotifications().getTimeout()),
                config.getNotifications().getMaxAttempts(),
                Clock.systemUTC()
            ))
            .build();

        return new TaskRunController(config, reconciler, runs, queue, timeouts, client);
    }

    /**
     * Enqueues every existing run, arms the timeouts of the ones already started, then starts the
     * workers and the watches.
     */
    public void start() throws StoreException {
        running = true;

        List<TaskRun> existing = runs.list();
        for (TaskRun run : existing) {
            reconciler.resume(run);
            queue.add(run.key());
        }
        log.info("Starting with {} existing run(s) and {} worker(s)", existing.size(), config.getWorkers());

        workers = Executors.newFixedThreadPool(
            config.getWorkers(),
            new ThreadFactoryBuilder()
                .setNameFormat("taskrun-worker-%d")
                .build()
        );
        for (int i = 0; i < config.getWorkers(); i++) {
            workers.submit(this::work);
        }

        if (client != null) {
            this.watchPods();
            this.watchRuns();
        }
    }

    public void enqueue(String key) {
        queue.add(key);
    }

    private void watchPods() {
        synchronized (watches) {
            watches.add(client.pods()
                .inAnyNamespace()
                .withLabel(TaskPodBuilder.LABEL_TASK_RUN)
                .watch(new PodWatcher(log, queue::add, this::onWatchFailure))
            );
        }
    }

    private void watchRuns() {
        synchronized (watches) {
            watches.add(client.genericKubernetesResources(TaskRun.API_VERSION, TaskRun.KIND)
                .inAnyNamespace()
                .watch(new TaskRunWatcher(log, queue::add, this::onWatchFailure))
            );
        }
    }

    private void onWatchFailure() {
        if (!running) {
            return;
        }

        log.warn("Watch closed unexpectedly, restarting the watches with a full resync");
        this.closeWatches();
        this.watchPods();
        this.watchRuns();

        try {
            runs.list().forEach(run -> queue.add(run.key()));
        } catch (StoreException e) {
            log.error("Unable to resync runs after watch failure", e);
        }
    }

    private void work() {
        while (running) {
            String key;
            try {
                key = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            if (key == null) {
                return;
            }

            try {
                this.process(key);
            } finally {
                queue.done(key);
            }
        }
    }

    void process(String key) {
        try {
            ReconcileOutcome outcome = reconciler.reconcile(key);

            if (outcome == ReconcileOutcome.REQUEUE) {
                queue.addRateLimited(key);
            } else {
                queue.forget(key);
            }
        } catch (ReconcileException e) {
            log.warn("Reconcile of '{}' failed, will retry: {}", key, e.getMessage(), e);
            queue.addRateLimited(key);
        } catch (RuntimeException e) {
            log.error("Unexpected error while reconciling '{}'", key, e);
            queue.addRateLimited(key);
        }
    }

    private void closeWatches() {
        synchronized (watches) {
            watches.forEach(Watch::close);
            watches.clear();
        }
    }

    @Override
    public void close() {
        running = false;

        this.closeWatches();
        queue.shutdown();
        timeouts.shutdown();

        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        if (client != null) {
            client.close();
        }

        log.info("Controller stopped");
    }

    public static void main(String[] args) throws IOException, StoreException, InterruptedException {
        ControllerConfig config = args.length > 0 ? ControllerConfig.load(Path.of(args[0])) : ControllerConfig.defaults();

        CountDownLatch stopped = new CountDownLatch(1);
        TaskRunController controller = TaskRunController.create(config);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            controller.close();
            stopped.countDown();
        }, "taskrun-controller-shutdown"));

        controller.start();
        stopped.await();
    }
}
