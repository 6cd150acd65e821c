package com.snapkeeper.worker;

import com.snapkeeper.core.handler.EventHandlerPipeline;
import com.snapkeeper.core.model.WorkerConfig;

/**
 * Creates camera workers wired to the event handler pipeline.
 */
@FunctionalInterface
public interface WorkerFactory {

    Worker create(WorkerConfig config, EventHandlerPipeline pipeline);
}
