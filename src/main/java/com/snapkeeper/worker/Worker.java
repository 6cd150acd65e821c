package com.snapkeeper.worker;

import com.snapkeeper.core.model.WorkerConfig;

/**
 * A long-running loop polling one camera and emitting events.
 * <p>
 * The supervisor runs {@link #run()} on its own thread. {@code run} returns
 * once the worker is stopped; any exception escaping it counts as a crash.
 */
public interface Worker extends Runnable {

    /**
     * @return the worker name (camera exid), stable across reconfiguration
     */
    String name();

    /**
     * @return the config the worker currently polls with
     */
    WorkerConfig config();

    /**
     * Applies a new configuration without restarting the worker. The next
     * poll uses the new settings.
     *
     * @throws IllegalArgumentException if the config belongs to another worker
     */
    void updateConfig(WorkerConfig config);

    /**
     * Requests the loop to end. The worker stops within one in-flight poll.
     */
    void stop();

    boolean isRunning();
}
