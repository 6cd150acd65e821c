package com.snapkeeper.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Starts the camera workers in the background once the application is ready,
 * so a slow or large catalog never delays startup.
 * <p>
 * Disabled with {@code snapkeeper.workers.start-camera-workers=false}.
 */
@Component
public class WorkerBootstrap {

    private static final Logger log = LoggerFactory.getLogger(WorkerBootstrap.class);

    private final WorkerSupervisor supervisor;
    private final SupervisorProperties properties;
    private final ExecutorService bootstrapExecutor;

    public WorkerBootstrap(WorkerSupervisor supervisor,
                           SupervisorProperties properties,
                           @Qualifier("bootstrapExecutor") ExecutorService bootstrapExecutor) {
        this.supervisor = supervisor;
        this.properties = properties;
        this.bootstrapExecutor = bootstrapExecutor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isStartCameraWorkers()) {
            log.info("Camera worker bootstrap disabled");
            return;
        }
        start();
    }

    /**
     * Runs {@link WorkerSupervisor#initiateWorkers()} on the bootstrap executor.
     * Failures are logged; the returned future still completes exceptionally.
     */
    CompletableFuture<List<WorkerHandle>> start() {
        return CompletableFuture.supplyAsync(supervisor::initiateWorkers, bootstrapExecutor)
                .whenComplete((handles, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        log.error("Camera worker bootstrap failed: {}", cause.getMessage(), cause);
                    } else {
                        log.info("Camera worker bootstrap finished, {} workers started", handles.size());
                    }
                });
    }
}
