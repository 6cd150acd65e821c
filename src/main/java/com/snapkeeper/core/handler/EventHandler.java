package com.snapkeeper.core.handler;

import com.snapkeeper.core.events.WorkerEvent;

/**
 * Consumer of the events emitted by camera workers.
 * Implementations are Spring beans; exactly one per {@link HandlerType}.
 */
public interface EventHandler {

    /**
     * The capability this handler implements.
     */
    HandlerType type();

    /**
     * Called on the emitting worker's thread, in pipeline order.
     */
    void handle(WorkerEvent event);
}
