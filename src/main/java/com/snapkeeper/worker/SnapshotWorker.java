package com.snapkeeper.worker;

import com.snapkeeper.core.events.WorkerEvent;
import com.snapkeeper.core.logging.MdcContext;
import com.snapkeeper.core.model.CameraSettings;
import com.snapkeeper.core.model.WorkerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Polls one camera for snapshots until stopped.
 * <p>
 * All events are emitted from the polling thread, so handlers observe them in
 * order. A config update wakes a sleeping loop; a poll already in flight
 * finishes with the old settings.
 */
public class SnapshotWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(SnapshotWorker.class);

    private final String name;
    private final SnapshotFetcher fetcher;
    private final WorkerEventManager events;
    private final Clock clock;

    private final AtomicReference<WorkerConfig> config;
    private final AtomicBoolean configChanged = new AtomicBoolean();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();

    private volatile boolean stopped;
    private volatile boolean running;

    public SnapshotWorker(WorkerConfig config, SnapshotFetcher fetcher, WorkerEventManager events, Clock clock) {
        this.name = config.name();
        this.config = new AtomicReference<>(config);
        this.fetcher = fetcher;
        this.events = events;
        this.clock = clock;
    }

    @Override
    public void run() {
        if (stopped) {
            return;
        }
        running = true;
        MdcContext.setCamera(name);
        try {
            log.debug("[{}] Worker loop started", name);
            pause(config.get().settings().initialSleep());
            while (isActive()) {
                if (configChanged.getAndSet(false)) {
                    events.notify(WorkerEvent.configUpdated(name, clock.instant()));
                }
                CameraSettings settings = config.get().settings();
                poll(settings);
                pause(settings.sleep());
            }
            log.debug("[{}] Worker loop ended", name);
        } finally {
            running = false;
            MdcContext.clear();
        }
    }

    private void poll(CameraSettings settings) {
        byte[] image;
        try {
            image = fetcher.fetch(settings);
        } catch (SnapshotException e) {
            log.debug("[{}] Snapshot failed: {}", name, e.getMessage());
            events.notify(WorkerEvent.failed(name, clock.instant(), e.getMessage()));
            return;
        }
        events.notify(WorkerEvent.captured(name, clock.instant(), image));
    }

    /**
     * Sleeps up to {@code millis}, returning early on stop or config change.
     */
    private void pause(long millis) {
        long remaining = TimeUnit.MILLISECONDS.toNanos(Math.max(0, millis));
        lock.lock();
        try {
            while (remaining > 0 && !stopped && !configChanged.get()) {
                remaining = wakeUp.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            lock.unlock();
        }
    }

    private boolean isActive() {
        return !stopped && !Thread.currentThread().isInterrupted();
    }

    private void signal() {
        lock.lock();
        try {
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public WorkerConfig config() {
        return config.get();
    }

    @Override
    public void updateConfig(WorkerConfig newConfig) {
        if (!name.equals(newConfig.name())) {
            throw new IllegalArgumentException(
                    "Config for '" + newConfig.name() + "' cannot be applied to worker '" + name + "'");
        }
        config.set(newConfig);
        configChanged.set(true);
        signal();
        log.debug("[{}] Config updated, url={}", name, newConfig.settings().url());
    }

    @Override
    public void stop() {
        stopped = true;
        signal();
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
