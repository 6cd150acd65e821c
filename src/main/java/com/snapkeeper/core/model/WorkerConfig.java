package com.snapkeeper.core.model;

import com.snapkeeper.core.handler.HandlerType;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed to start or reconfigure one camera worker.
 *
 * @param name     worker identity (the camera exid)
 * @param handlers ordered event handler types the worker publishes to
 * @param settings polling settings
 */
public record WorkerConfig(
    String name,
    List<HandlerType> handlers,
    CameraSettings settings
) {

    public WorkerConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(settings, "settings");
        handlers = handlers == null ? List.of() : List.copyOf(handlers);
    }
}
