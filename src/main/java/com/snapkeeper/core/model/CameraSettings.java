package com.snapkeeper.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved per-camera settings a worker polls with.
 *
 * @param cameraId     catalog primary key
 * @param cameraExid   camera external id
 * @param vendorExid   vendor external id (nullable)
 * @param schedule     recording windows per day in the given order, empty when recording is off
 * @param timezone     IANA timezone id the schedule is expressed in
 * @param url          snapshot URL
 * @param auth         {@code user:password}, or empty
 * @param sleep        milliseconds between two polls
 * @param initialSleep milliseconds to wait before the first poll
 */
public record CameraSettings(
    long cameraId,
    String cameraExid,
    String vendorExid,
    Map<String, List<String>> schedule,
    String timezone,
    String url,
    String auth,
    long sleep,
    long initialSleep
) {

    public CameraSettings {
        schedule = schedule == null ? Map.of() : copyOf(schedule);
    }

    private static Map<String, List<String>> copyOf(Map<String, List<String>> schedule) {
        var copy = new LinkedHashMap<String, List<String>>();
        schedule.forEach((day, windows) -> copy.put(day, windows == null ? List.of() : List.copyOf(windows)));
        return Collections.unmodifiableMap(copy);
    }
}
