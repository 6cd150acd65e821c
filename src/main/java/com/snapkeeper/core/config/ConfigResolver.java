package com.snapkeeper.core.config;

import com.snapkeeper.core.handler.EventHandlerPipeline;
import com.snapkeeper.core.model.Camera;
import com.snapkeeper.core.model.CameraSettings;
import com.snapkeeper.core.model.CloudRecording;
import com.snapkeeper.core.model.WorkerConfig;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a {@link Camera} into the {@link WorkerConfig} its worker runs with.
 * <p>
 * Pure: no I/O and no shared mutable state, so resolving the same camera twice
 * yields equal configs.
 */
@Service
public class ConfigResolver {

    static final String DEFAULT_TIMEZONE = "Etc/UTC";
    static final long DEFAULT_SLEEP_MS = 1_000;
    static final List<String> DAYS = List.of(
            "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday");
    static final String WHOLE_DAY = "00:00-23:59";

    private final EventHandlerPipeline pipeline;

    public ConfigResolver(EventHandlerPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Resolves the worker configuration for a camera.
     *
     * @param camera the camera record
     * @return a fresh config named after the camera exid
     * @throws InvalidHostException when no valid snapshot URL can be derived
     * @throws IllegalArgumentException when the camera has no exid
     */
    public WorkerConfig resolve(Camera camera) throws InvalidHostException {
        if (camera.exid() == null || camera.exid().isBlank()) {
            throw new IllegalArgumentException("Camera " + camera.id() + " has no exid");
        }
        String url = snapshotUrl(camera);
        CloudRecording recording = camera.cloudRecording();

        var settings = new CameraSettings(
                camera.id(),
                camera.exid(),
                camera.vendorExid(),
                schedule(recording),
                camera.timezone() == null || camera.timezone().isBlank() ? DEFAULT_TIMEZONE : camera.timezone(),
                url,
                auth(camera),
                sleep(recording),
                initialSleep(camera.exid(), recording)
        );
        return new WorkerConfig(camera.exid(), pipeline.types(), settings);
    }

    static String snapshotUrl(Camera camera) throws InvalidHostException {
        String host = camera.externalHost();
        if (host == null || host.isBlank()) {
            throw new InvalidHostException(host == null ? "" : host);
        }

        String path = camera.snapshotPath();
        if ((path == null || path.isBlank()) && camera.vendor() != null) {
            path = camera.vendor().defaultSnapshotPath();
        }
        if (path == null || path.isBlank()) {
            path = "";
        } else if (!path.startsWith("/")) {
            path = "/" + path;
        }

        Integer port = camera.externalHttpPort();
        String url = "http://" + host.strip() + (port != null ? ":" + port : "") + path;
        try {
            URI uri = new URI(url);
            if (uri.getHost() == null) {
                throw new InvalidHostException(url);
            }
        } catch (URISyntaxException e) {
            throw new InvalidHostException(url);
        }
        return url;
    }

    static String auth(Camera camera) {
        String user = camera.username();
        String password = camera.password();
        if (user == null && password == null) {
            return "";
        }
        return (user != null ? user : "") + ":" + (password != null ? password : "");
    }

    static Map<String, List<String>> schedule(CloudRecording recording) {
        if (recording == null || recording.is(CloudRecording.STATUS_ON)) {
            var continuous = new LinkedHashMap<String, List<String>>();
            for (String day : DAYS) {
                continuous.put(day, List.of(WHOLE_DAY));
            }
            return continuous;
        }
        if (recording.is(CloudRecording.STATUS_OFF) || recording.schedule() == null) {
            return Map.of();
        }
        return recording.schedule();
    }

    static long sleep(CloudRecording recording) {
        if (recording == null
                || recording.is(CloudRecording.STATUS_OFF)
                || recording.is(CloudRecording.STATUS_PAUSED)
                || recording.frequency() <= 0) {
            return DEFAULT_SLEEP_MS;
        }
        return 60_000L / recording.frequency();
    }

    /**
     * Staggers the first poll so a bulk start does not hit every camera at once.
     * Derived from the exid rather than a random number to keep resolution repeatable.
     */
    static long initialSleep(String exid, CloudRecording recording) {
        if (recording == null
                || recording.is(CloudRecording.STATUS_OFF)
                || recording.frequency() == 1) {
            return DEFAULT_SLEEP_MS;
        }
        return 1_000L * (1 + Math.floorMod(exid.hashCode(), 60));
    }
}
