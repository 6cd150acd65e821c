package com.snapkeeper.worker;

import com.snapkeeper.core.handler.EventHandlerPipeline;
import com.snapkeeper.core.model.WorkerConfig;

import java.time.Clock;

/**
 * Builds {@link SnapshotWorker}s, subscribing each to the pipeline before it runs.
 */
public class SnapshotWorkerFactory implements WorkerFactory {

    private final SnapshotFetcher fetcher;
    private final Clock clock;

    public SnapshotWorkerFactory(SnapshotFetcher fetcher, Clock clock) {
        this.fetcher = fetcher;
        this.clock = clock;
    }

    @Override
    public Worker create(WorkerConfig config, EventHandlerPipeline pipeline) {
        var events = new WorkerEventManager(config.name(), pipeline);
        return new SnapshotWorker(config, fetcher, events, clock);
    }
}
