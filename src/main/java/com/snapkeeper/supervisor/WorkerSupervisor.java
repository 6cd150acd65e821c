package com.snapkeeper.supervisor;

import com.snapkeeper.core.catalog.CameraCatalog;
import com.snapkeeper.core.config.ConfigResolver;
import com.snapkeeper.core.config.InvalidHostException;
import com.snapkeeper.core.handler.EventHandlerPipeline;
import com.snapkeeper.core.metrics.SnapkeeperMetrics;
import com.snapkeeper.core.model.Camera;
import com.snapkeeper.core.model.WorkerConfig;
import com.snapkeeper.core.model.WorkerStatus;
import com.snapkeeper.streaming.StreamerSupervisor;
import com.snapkeeper.worker.Worker;
import com.snapkeeper.worker.WorkerFactory;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Supervises one snapshot worker per camera.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Resolves camera config via {@link ConfigResolver} and creates workers through
 *       {@link WorkerFactory}, each wired to the {@link EventHandlerPipeline}</li>
 *   <li>Keeps the registry of live workers keyed by camera exid</li>
 *   <li>Pushes new config into running workers in place</li>
 *   <li>Restarts crashed workers one at a time, with the same name and latest config,
 *       until the per-worker restart budget runs out</li>
 * </ul>
 *
 * <p>Starting a name that is already registered is rejected: the existing handle is
 * returned untouched. A worker that stayed up for {@code restart-window} before
 * crashing gets its restart budget back.
 */
@Service
public class WorkerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    private final ConfigResolver configResolver;
    private final WorkerFactory workerFactory;
    private final EventHandlerPipeline pipeline;
    private final CameraCatalog cameraCatalog;
    private final StreamerSupervisor streamerSupervisor;
    private final SupervisorProperties properties;
    private final SnapkeeperMetrics metrics;
    private final ExecutorService workerExecutor;
    private final ScheduledExecutorService restartScheduler;
    private final Clock clock;

    /** Live workers keyed by camera exid. */
    private final ConcurrentHashMap<String, WorkerHandle> workers = new ConcurrentHashMap<>();

    private volatile boolean shuttingDown;

    public WorkerSupervisor(ConfigResolver configResolver,
                            WorkerFactory workerFactory,
                            EventHandlerPipeline pipeline,
                            CameraCatalog cameraCatalog,
                            StreamerSupervisor streamerSupervisor,
                            SupervisorProperties properties,
                            SnapkeeperMetrics metrics,
                            @Qualifier("workerExecutor") ExecutorService workerExecutor,
                            @Qualifier("restartScheduler") ScheduledExecutorService restartScheduler,
                            Clock clock) {
        this.configResolver = configResolver;
        this.workerFactory = workerFactory;
        this.pipeline = pipeline;
        this.cameraCatalog = cameraCatalog;
        this.streamerSupervisor = streamerSupervisor;
        this.properties = properties;
        this.metrics = metrics;
        this.workerExecutor = workerExecutor;
        this.restartScheduler = restartScheduler;
        this.clock = clock;
        metrics.registerActiveWorkersGauge(workers::size);
    }

    /**
     * Starts a supervised worker for a camera.
     *
     * @param camera the camera, may be null (no-op)
     * @return the handle of the running worker, or empty when the camera is null or
     *         has no exid, its host is invalid, its worker cannot be created, or the
     *         supervisor is shutting down
     */
    public Optional<WorkerHandle> startWorker(Camera camera) {
        if (camera == null) {
            return Optional.empty();
        }
        if (!hasExid(camera)) {
            log.warn("Skipping camera worker for camera {} as it has no exid", camera.id());
            metrics.recordWorkerSkipped("missing_exid");
            return Optional.empty();
        }
        WorkerConfig config;
        try {
            config = configResolver.resolve(camera);
        } catch (InvalidHostException e) {
            log.warn("[{}] Skipping camera worker as the host is invalid: {}", camera.exid(), e.getUrl());
            metrics.recordWorkerSkipped("invalid_host");
            return Optional.empty();
        }
        return startSupervised(config);
    }

    private Optional<WorkerHandle> startSupervised(WorkerConfig config) {
        if (shuttingDown) {
            log.warn("[{}] Supervisor is shutting down, not starting worker", config.name());
            return Optional.empty();
        }
        var handle = new WorkerHandle(config.name(), config);
        synchronized (handle) {
            WorkerHandle existing = workers.putIfAbsent(config.name(), handle);
            if (existing != null) {
                log.debug("[{}] Worker already started ({}), keeping it", config.name(), existing.status());
                return Optional.of(existing);
            }
            log.debug("[{}] Starting worker", config.name());
            try {
                launch(handle);
            } catch (RuntimeException e) {
                log.error("[{}] Could not start worker: {}", config.name(), e.toString(), e);
                metrics.recordWorkerSkipped("start_failed");
                release(handle);
                return Optional.empty();
            }
        }
        metrics.recordWorkerStarted();
        return Optional.of(handle);
    }

    /**
     * Creates a fresh worker from the handle's current config and runs it.
     * Caller holds the handle's monitor.
     *
     * @throws RejectedExecutionException when the worker executor no longer accepts work
     * @throws RuntimeException whatever the {@link WorkerFactory} throws
     */
    private void launch(WorkerHandle handle) {
        Worker worker = workerFactory.create(handle.config(), pipeline);
        handle.attach(worker);
        CompletableFuture
                .runAsync(() -> {
                    handle.markRunning(worker, clock.instant());
                    worker.run();
                }, workerExecutor)
                .whenComplete((ignored, error) -> onWorkerExit(handle, worker, error));
    }

    private void onWorkerExit(WorkerHandle handle, Worker worker, Throwable error) {
        synchronized (handle) {
            if (handle.worker() != worker || handle.status() == WorkerStatus.STOPPED || shuttingDown) {
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause != null) {
                log.warn("[{}] Worker crashed: {}", handle.name(), cause.toString(), cause);
                handle.markCrashed(cause.toString());
            } else {
                log.warn("[{}] Worker exited without being stopped", handle.name());
                handle.markCrashed("exited");
            }
            if (handle.ranLongerThan(properties.getRestartWindow(), clock.instant())) {
                handle.resetRestarts();
            }
            scheduleRestart(handle);
        }
    }

    /** Caller holds the handle's monitor and has marked it crashed. */
    private void scheduleRestart(WorkerHandle handle) {
        if (handle.restarts() >= properties.getMaxRestarts()) {
            log.error("[{}] Restart budget of {} exhausted, giving up on worker",
                    handle.name(), properties.getMaxRestarts());
            release(handle);
            return;
        }

        handle.markRestarting();
        try {
            restartScheduler.schedule(() -> restart(handle),
                    properties.getRestartDelay().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Restart scheduler rejected the restart, dropping worker", handle.name());
            release(handle);
        }
    }

    private void restart(WorkerHandle handle) {
        synchronized (handle) {
            if (handle.status() != WorkerStatus.RESTARTING || shuttingDown) {
                return;
            }
            log.info("[{}] Restarting worker (restart #{})", handle.name(), handle.restarts());
            metrics.recordWorkerRestart();
            try {
                launch(handle);
            } catch (RejectedExecutionException e) {
                log.warn("[{}] Worker executor rejected the restart, dropping worker", handle.name());
                release(handle);
            } catch (RuntimeException e) {
                log.warn("[{}] Could not recreate worker: {}", handle.name(), e.toString(), e);
                handle.markCrashed(e.toString());
                scheduleRestart(handle);
            }
        }
    }

    /** Marks the handle stopped and frees its name. Caller holds the handle's monitor. */
    private void release(WorkerHandle handle) {
        handle.markStopped();
        workers.remove(handle.name(), handle);
    }

    /**
     * Reconfigures the running worker registered under {@code name}.
     *
     * @return true if the new config was delivered
     */
    public boolean updateWorker(String name, Camera camera) {
        WorkerHandle handle = workers.get(name);
        if (handle == null) {
            log.warn("[{}] No running worker to update", name);
            metrics.recordWorkerUpdate(false);
            return false;
        }
        return updateWorker(handle, camera);
    }

    /**
     * Reconfigures a running worker in place: the streaming subsystem is asked to
     * restart the camera's stream, then the worker receives the new config without
     * losing its name or handler subscription. When the camera does not resolve,
     * the worker keeps running with its current config.
     *
     * @return true if the new config was delivered
     */
    public boolean updateWorker(WorkerHandle handle, Camera camera) {
        if (camera == null || !hasExid(camera)) {
            log.warn("[{}] Ignoring update without a camera exid", handle.name());
            metrics.recordWorkerUpdate(false);
            return false;
        }
        WorkerConfig config;
        try {
            config = configResolver.resolve(camera);
        } catch (InvalidHostException e) {
            log.info("[{}] Skipping camera worker update as the host is invalid: {}", handle.name(), e.getUrl());
            metrics.recordWorkerUpdate(false);
            return false;
        }
        if (!handle.name().equals(config.name())) {
            log.warn("[{}] Refusing update from camera '{}': a worker keeps its name",
                    handle.name(), config.name());
            metrics.recordWorkerUpdate(false);
            return false;
        }
        if (!isLive(handle)) {
            log.warn("[{}] Worker is no longer running, update dropped", handle.name());
            metrics.recordWorkerUpdate(false);
            return false;
        }

        log.info("Updating worker for {}", handle.name());
        try {
            streamerSupervisor.restartStreamer(handle.name());
        } catch (RuntimeException e) {
            log.warn("[{}] Streamer restart failed: {}", handle.name(), e.getMessage());
        }

        synchronized (handle) {
            if (!isLive(handle)) {
                log.warn("[{}] Worker stopped during update, update dropped", handle.name());
                metrics.recordWorkerUpdate(false);
                return false;
            }
            handle.replaceConfig(config);
            Worker worker = handle.worker();
            if (worker != null) {
                worker.updateConfig(config);
            }
        }
        metrics.recordWorkerUpdate(true);
        return true;
    }

    /**
     * Starts a worker for every camera in the catalog.
     *
     * @return handles of the workers that are running afterwards
     * @throws com.snapkeeper.core.catalog.CatalogUnavailableException when the catalog cannot be read
     */
    public List<WorkerHandle> initiateWorkers() {
        log.info("Initiate workers for snapshot recording.");
        List<Camera> cameras = cameraCatalog.listAll();
        var started = new ArrayList<WorkerHandle>();
        for (Camera camera : cameras) {
            try {
                startWorker(camera).ifPresent(started::add);
            } catch (RuntimeException e) {
                log.error("[{}] Failed to start camera worker: {}",
                        camera != null ? camera.exid() : null, e.getMessage(), e);
            }
        }
        log.info("{} of {} camera workers running", started.size(), cameras.size());
        return started;
    }

    /**
     * Stops a worker for good and releases its name.
     *
     * @return false if no worker was registered under {@code name}
     */
    public boolean stopWorker(String name) {
        WorkerHandle handle = workers.get(name);
        if (handle == null) {
            return false;
        }
        synchronized (handle) {
            if (handle.status() == WorkerStatus.STOPPED) {
                return false;
            }
            release(handle);
            Worker worker = handle.worker();
            if (worker != null) {
                worker.stop();
            }
        }
        log.info("[{}] Worker stopped", name);
        return true;
    }

    public Optional<WorkerHandle> findWorker(String name) {
        return Optional.ofNullable(workers.get(name));
    }

    public List<WorkerHandle> listWorkers() {
        return List.copyOf(workers.values());
    }

    public int size() {
        return workers.size();
    }

    private static boolean hasExid(Camera camera) {
        return camera.exid() != null && !camera.exid().isBlank();
    }

    private boolean isLive(WorkerHandle handle) {
        return handle.status() != WorkerStatus.STOPPED && workers.get(handle.name()) == handle;
    }

    @PreDestroy
    void shutdown() {
        shuttingDown = true;
        log.info("Stopping {} camera workers", workers.size());
        for (WorkerHandle handle : workers.values()) {
            synchronized (handle) {
                handle.markStopped();
                Worker worker = handle.worker();
                if (worker != null) {
                    worker.stop();
                }
            }
        }
        workers.clear();
        restartScheduler.shutdownNow();
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(properties.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Camera workers did not stop within {}", properties.getShutdownTimeout());
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerExecutor.shutdownNow();
        }
    }
}
