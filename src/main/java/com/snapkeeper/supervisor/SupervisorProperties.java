package com.snapkeeper.supervisor;

import com.snapkeeper.core.handler.HandlerType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "snapkeeper.workers")
public class SupervisorProperties {

    /** Start a worker for every catalog camera once the application is ready. */
    private boolean startCameraWorkers = true;

    /** Enabled event handlers, in delivery order. */
    private List<HandlerType> handlers = new ArrayList<>(List.of(
            HandlerType.BROADCAST,
            HandlerType.PERSISTENCE,
            HandlerType.POLL_CONTROL,
            HandlerType.STORAGE));

    /** Restarts allowed per worker before it is given up on. */
    private int maxRestarts = 1_000_000;

    private Duration restartDelay = Duration.ofSeconds(1);

    /** A worker that stays up this long before crashing starts over with a full restart budget. */
    private Duration restartWindow = Duration.ofMinutes(1);
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    public boolean isStartCameraWorkers() { return startCameraWorkers; }
    public void setStartCameraWorkers(boolean startCameraWorkers) { this.startCameraWorkers = startCameraWorkers; }
    public List<HandlerType> getHandlers() { return handlers; }
    public void setHandlers(List<HandlerType> handlers) { this.handlers = handlers; }
    public int getMaxRestarts() { return maxRestarts; }
    public void setMaxRestarts(int maxRestarts) { this.maxRestarts = maxRestarts; }
    public Duration getRestartDelay() { return restartDelay; }
    public void setRestartDelay(Duration restartDelay) { this.restartDelay = restartDelay; }
    public Duration getRestartWindow() { return restartWindow; }
    public void setRestartWindow(Duration restartWindow) { this.restartWindow = restartWindow; }
    public Duration getShutdownTimeout() { return shutdownTimeout; }
    public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
}
