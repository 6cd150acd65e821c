package com.snapkeeper.core.model;

import java.util.List;
import java.util.Map;

/**
 * Cloud recording settings of a camera.
 *
 * @param status    one of {@code on}, {@code off}, {@code on-scheduled}, {@code paused}
 * @param frequency frames per minute
 * @param schedule  day name to list of {@code HH:mm-HH:mm} windows
 */
public record CloudRecording(
    String status,
    int frequency,
    Map<String, List<String>> schedule
) {

    public static final String STATUS_ON = "on";
    public static final String STATUS_OFF = "off";
    public static final String STATUS_SCHEDULED = "on-scheduled";
    public static final String STATUS_PAUSED = "paused";

    public boolean is(String candidate) {
        return candidate.equalsIgnoreCase(status);
    }
}
