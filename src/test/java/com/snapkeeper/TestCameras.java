package com.snapkeeper;

import com.snapkeeper.core.model.Camera;
import com.snapkeeper.core.model.CloudRecording;
import com.snapkeeper.core.model.Vendor;

import java.util.List;
import java.util.Map;

/**
 * Camera fixtures shared by tests.
 */
public final class TestCameras {

    private TestCameras() {}

    public static Camera camera(String exid) {
        return new Camera(1L, exid, new Vendor("acme", "/snapshot.jpg"),
                "10.0.0.1", 8080, "/live", "admin", "secret", "Europe/Dublin",
                new CloudRecording(CloudRecording.STATUS_ON, 12, Map.of()));
    }

    public static Camera camera(String exid, String host) {
        return new Camera(1L, exid, new Vendor("acme", "/snapshot.jpg"),
                host, null, "/live", null, null, null, null);
    }

    public static Camera scheduled(String exid) {
        return new Camera(2L, exid, new Vendor("acme", "/snapshot.jpg"),
                "cam.example.com", null, null, "user", null, "America/New_York",
                new CloudRecording(CloudRecording.STATUS_SCHEDULED, 6,
                        Map.of("Monday", List.of("08:00-18:00"))));
    }
}
