package com.snapkeeper.worker;

import com.snapkeeper.core.events.WorkerEvent;
import com.snapkeeper.core.handler.EventHandler;
import com.snapkeeper.core.handler.EventHandlerPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Per-worker fan-out of events to the handler pipeline.
 * <p>
 * Subscribed when the worker is built, before it emits anything. Delivery is
 * synchronous and in pipeline order; a failing handler does not keep the event
 * from the handlers after it.
 */
public class WorkerEventManager {

    private static final Logger log = LoggerFactory.getLogger(WorkerEventManager.class);

    private final String workerName;
    private final List<EventHandler> handlers;

    public WorkerEventManager(String workerName, EventHandlerPipeline pipeline) {
        this.workerName = workerName;
        this.handlers = pipeline.handlers();
    }

    public void notify(WorkerEvent event) {
        for (EventHandler handler : handlers) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                log.warn("[{}] {} handler failed on {}: {}",
                        workerName, handler.type(), event.type(), e.getMessage(), e);
            }
        }
    }

    public List<EventHandler> handlers() {
        return handlers;
    }
}
