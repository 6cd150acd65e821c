package com.snapkeeper.supervisor;

import com.snapkeeper.core.catalog.CatalogUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WorkerBootstrapTest {

    private WorkerSupervisor supervisor;
    private SupervisorProperties properties;
    private ExecutorService executor;
    private WorkerBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        supervisor = mock(WorkerSupervisor.class);
        properties = new SupervisorProperties();
        executor = Executors.newSingleThreadExecutor();
        bootstrap = new WorkerBootstrap(supervisor, properties, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("runs the bulk start in the background when enabled")
    void runsInBackground() {
        var release = new CountDownLatch(1);
        when(supervisor.initiateWorkers()).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });

        long started = System.nanoTime();
        bootstrap.onApplicationReady();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(elapsedMs < 1_000, "bootstrap must not block the caller");
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(supervisor).initiateWorkers());
        release.countDown();
    }

    @Test
    @DisplayName("does nothing when camera worker bootstrap is disabled")
    void disabled() {
        properties.setStartCameraWorkers(false);

        bootstrap.onApplicationReady();

        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1))
                .untilAsserted(() -> verifyNoInteractions(supervisor));
    }

    @Test
    @DisplayName("a failing catalog is reported through the future, not thrown")
    void failureIsContained() {
        when(supervisor.initiateWorkers()).thenThrow(new CatalogUnavailableException("db down"));

        var future = assertDoesNotThrow(() -> bootstrap.start());

        var ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(CatalogUnavailableException.class, ex.getCause());
    }
}
