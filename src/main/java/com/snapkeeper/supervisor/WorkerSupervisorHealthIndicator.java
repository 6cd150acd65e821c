package com.snapkeeper.supervisor;

import com.snapkeeper.core.model.WorkerStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Actuator health indicator for the camera worker pool.
 * <p>
 * Always UP while the supervisor runs (a crashing camera is not a failure of
 * the service); DEGRADED while any worker is crashed or waiting to restart.
 */
@Component("workerSupervisorHealthIndicator")
public class WorkerSupervisorHealthIndicator implements HealthIndicator {

    private final WorkerSupervisor supervisor;

    public WorkerSupervisorHealthIndicator(WorkerSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Override
    public Health health() {
        Map<WorkerStatus, Integer> counts = new EnumMap<>(WorkerStatus.class);
        for (WorkerHandle handle : supervisor.listWorkers()) {
            counts.merge(handle.status(), 1, Integer::sum);
        }

        var builder = Health.up().withDetail("workers", supervisor.size());
        for (var entry : counts.entrySet()) {
            builder.withDetail(entry.getKey().name().toLowerCase(Locale.ROOT), entry.getValue());
        }

        int failing = counts.getOrDefault(WorkerStatus.CRASHED, 0)
                + counts.getOrDefault(WorkerStatus.RESTARTING, 0);
        return failing > 0 ? builder.status("DEGRADED").build() : builder.build();
    }
}
