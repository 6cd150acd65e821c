package com.snapkeeper.supervisor;

import com.snapkeeper.core.catalog.CameraCatalog;
import com.snapkeeper.core.catalog.CatalogProperties;
import com.snapkeeper.core.catalog.JsonFileCameraCatalog;
import com.snapkeeper.core.handler.EventHandler;
import com.snapkeeper.core.handler.EventHandlerPipeline;
import com.snapkeeper.streaming.LoggingStreamerSupervisor;
import com.snapkeeper.streaming.StreamerSupervisor;
import com.snapkeeper.worker.FetcherProperties;
import com.snapkeeper.worker.HttpSnapshotFetcher;
import com.snapkeeper.worker.SnapshotFetcher;
import com.snapkeeper.worker.SnapshotWorkerFactory;
import com.snapkeeper.worker.WorkerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class SupervisorConfig {

    /**
     * The handler list is fixed here, once; changing it means changing
     * {@code snapkeeper.workers.handlers} and restarting.
     */
    @Bean
    public EventHandlerPipeline eventHandlerPipeline(SupervisorProperties properties,
                                                     ObjectProvider<EventHandler> handlers) {
        return EventHandlerPipeline.of(properties.getHandlers(), handlers.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public CameraCatalog cameraCatalog(CatalogProperties properties) {
        return new JsonFileCameraCatalog(Path.of(properties.getFile()));
    }

    @Bean
    @ConditionalOnMissingBean
    public StreamerSupervisor streamerSupervisor() {
        return new LoggingStreamerSupervisor();
    }

    @Bean
    @ConditionalOnMissingBean
    public SnapshotFetcher snapshotFetcher(FetcherProperties properties) {
        return new HttpSnapshotFetcher(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerFactory workerFactory(SnapshotFetcher snapshotFetcher, Clock clock) {
        return new SnapshotWorkerFactory(snapshotFetcher, clock);
    }

    /** One thread per camera worker loop. */
    @Bean(name = "workerExecutor")
    public ExecutorService workerExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("snapkeeper-worker-"));
    }

    @Bean(name = "restartScheduler")
    public ScheduledExecutorService restartScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("snapkeeper-restart-"));
    }

    @Bean(name = "bootstrapExecutor")
    public ExecutorService bootstrapExecutor() {
        return Executors.newSingleThreadExecutor(daemonThreads("snapkeeper-bootstrap-"));
    }

    static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
