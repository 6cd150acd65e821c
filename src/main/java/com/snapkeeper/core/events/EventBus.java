package com.snapkeeper.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Live feed of worker events, one channel per camera.
 * <p>
 * A channel exists only while it has viewers: the last unsubscribe for a camera
 * drops its entry, so cameras nobody watches cost nothing.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, List<Consumer<WorkerEvent>>> viewers = new ConcurrentHashMap<>();

    /**
     * Delivers an event to the viewers of its camera. A viewer that throws is
     * logged and does not keep the others from receiving the event.
     */
    public void publish(WorkerEvent event) {
        List<Consumer<WorkerEvent>> channel = viewers.get(event.cameraExid());
        if (channel == null) {
            return;
        }
        for (Consumer<WorkerEvent> viewer : channel) {
            try {
                viewer.accept(event);
            } catch (RuntimeException e) {
                log.warn("[{}] Viewer failed on {}: {}", event.cameraExid(), event.type(), e.getMessage(), e);
            }
        }
    }

    public boolean isWatched(String cameraExid) {
        return viewers.containsKey(cameraExid);
    }

    /**
     * Starts following one camera.
     *
     * @return a handle that stops delivery to {@code viewer}
     */
    public Subscription subscribe(String cameraExid, Consumer<WorkerEvent> viewer) {
        viewers.compute(cameraExid, (exid, channel) -> {
            List<Consumer<WorkerEvent>> updated = channel != null ? channel : new CopyOnWriteArrayList<>();
            updated.add(viewer);
            return updated;
        });
        log.debug("[{}] Viewer subscribed", cameraExid);
        return () -> viewers.computeIfPresent(cameraExid, (exid, channel) -> {
            channel.remove(viewer);
            return channel.isEmpty() ? null : channel;
        });
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
