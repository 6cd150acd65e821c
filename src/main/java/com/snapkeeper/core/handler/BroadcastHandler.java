package com.snapkeeper.core.handler;

import com.snapkeeper.core.events.EventBus;
import com.snapkeeper.core.events.WorkerEvent;
import org.springframework.stereotype.Component;

/**
 * Republishes worker events on the in-process {@link EventBus} for cameras
 * somebody is watching.
 */
@Component
public class BroadcastHandler implements EventHandler {

    private final EventBus eventBus;

    public BroadcastHandler(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public HandlerType type() {
        return HandlerType.BROADCAST;
    }

    @Override
    public void handle(WorkerEvent event) {
        if (eventBus.isWatched(event.cameraExid())) {
            eventBus.publish(event);
        }
    }
}
