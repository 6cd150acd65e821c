package com.snapkeeper.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by a camera worker.
 *
 * @param type       what happened
 * @param cameraExid the camera (worker name) the event belongs to
 * @param timestamp  when the event occurred
 * @param image      JPEG bytes for {@link Type#SNAPSHOT_CAPTURED}, otherwise null
 * @param detail     arbitrary key-value data (e.g. the failure reason)
 */
public record WorkerEvent(
    Type type,
    String cameraExid,
    Instant timestamp,
    byte[] image,
    Map<String, Object> detail
) {

    public WorkerEvent {
        detail = detail == null ? Map.of() : Map.copyOf(detail);
    }

    public enum Type {
        SNAPSHOT_CAPTURED,
        SNAPSHOT_FAILED,
        CONFIG_UPDATED
    }

    public static WorkerEvent captured(String cameraExid, Instant timestamp, byte[] image) {
        return new WorkerEvent(Type.SNAPSHOT_CAPTURED, cameraExid, timestamp, image, Map.of());
    }

    public static WorkerEvent failed(String cameraExid, Instant timestamp, String reason) {
        return new WorkerEvent(Type.SNAPSHOT_FAILED, cameraExid, timestamp, null,
                Map.of("reason", reason != null ? reason : "unknown"));
    }

    public static WorkerEvent configUpdated(String cameraExid, Instant timestamp) {
        return new WorkerEvent(Type.CONFIG_UPDATED, cameraExid, timestamp, null, Map.of());
    }
}
