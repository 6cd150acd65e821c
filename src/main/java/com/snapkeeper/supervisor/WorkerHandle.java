package com.snapkeeper.supervisor;

import com.snapkeeper.core.model.WorkerConfig;
import com.snapkeeper.core.model.WorkerStatus;
import com.snapkeeper.worker.Worker;

import java.time.Duration;
import java.time.Instant;

/**
 * Registry entry for one supervised worker name.
 * <p>
 * The handle outlives individual {@link Worker} instances: a restart attaches a
 * new worker to the same handle. All state is guarded by the handle's monitor,
 * which is also what serializes start, update, restart and stop for a name.
 */
public final class WorkerHandle {

    private final String name;

    private WorkerConfig config;
    private Worker worker;
    private WorkerStatus status = WorkerStatus.STARTING;
    private int restarts;
    private String lastFailure;
    private Instant runningSince;

    WorkerHandle(String name, WorkerConfig config) {
        this.name = name;
        this.config = config;
    }

    public String name() {
        return name;
    }

    public synchronized WorkerConfig config() {
        return config;
    }

    public synchronized WorkerStatus status() {
        return status;
    }

    /** Restarts since the worker was last healthy for a full restart window. */
    public synchronized int restarts() {
        return restarts;
    }

    /** Message of the most recent crash, null if the worker never crashed. */
    public synchronized String lastFailure() {
        return lastFailure;
    }

    synchronized Worker worker() {
        return worker;
    }

    synchronized void attach(Worker worker) {
        this.worker = worker;
        this.status = WorkerStatus.STARTING;
        this.runningSince = null;
    }

    synchronized void markRunning(Worker candidate, Instant now) {
        if (worker == candidate && status != WorkerStatus.STOPPED) {
            status = WorkerStatus.RUNNING;
            runningSince = now;
        }
    }

    /** True when the current worker has been running for at least {@code window}. */
    synchronized boolean ranLongerThan(Duration window, Instant now) {
        return runningSince != null && Duration.between(runningSince, now).compareTo(window) >= 0;
    }

    synchronized void resetRestarts() {
        restarts = 0;
    }

    synchronized void markCrashed(String failure) {
        status = WorkerStatus.CRASHED;
        lastFailure = failure;
    }

    synchronized void markRestarting() {
        status = WorkerStatus.RESTARTING;
        restarts++;
    }

    synchronized void markStopped() {
        status = WorkerStatus.STOPPED;
    }

    synchronized void replaceConfig(WorkerConfig config) {
        this.config = config;
    }

    @Override
    public synchronized String toString() {
        return "WorkerHandle[" + name + ", " + status + ", restarts=" + restarts + "]";
    }
}
