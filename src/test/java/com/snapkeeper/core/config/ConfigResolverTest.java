package com.snapkeeper.core.config;

import com.snapkeeper.TestCameras;
import com.snapkeeper.core.handler.EventHandler;
import com.snapkeeper.core.handler.EventHandlerPipeline;
import com.snapkeeper.core.handler.HandlerType;
import com.snapkeeper.core.model.Camera;
import com.snapkeeper.core.model.CloudRecording;
import com.snapkeeper.core.model.Vendor;
import com.snapkeeper.core.model.WorkerConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConfigResolverTest {

    private ConfigResolver resolver;

    @BeforeEach
    void setUp() {
        EventHandler broadcast = mock(EventHandler.class);
        when(broadcast.type()).thenReturn(HandlerType.BROADCAST);
        EventHandler storage = mock(EventHandler.class);
        when(storage.type()).thenReturn(HandlerType.STORAGE);
        var pipeline = EventHandlerPipeline.of(
                List.of(HandlerType.BROADCAST, HandlerType.STORAGE), List.of(storage, broadcast));
        resolver = new ConfigResolver(pipeline);
    }

    @Test
    @DisplayName("resolves a complete camera into worker settings")
    void resolvesCompleteCamera() throws Exception {
        WorkerConfig config = resolver.resolve(TestCameras.camera("cam1"));

        assertEquals("cam1", config.name());
        assertEquals(List.of(HandlerType.BROADCAST, HandlerType.STORAGE), config.handlers());
        var settings = config.settings();
        assertEquals(1L, settings.cameraId());
        assertEquals("cam1", settings.cameraExid());
        assertEquals("acme", settings.vendorExid());
        assertEquals("http://10.0.0.1:8080/live", settings.url());
        assertEquals("admin:secret", settings.auth());
        assertEquals("Europe/Dublin", settings.timezone());
        assertEquals(5_000, settings.sleep());
        assertEquals(7, settings.schedule().size());
        assertEquals(List.of("00:00-23:59"), settings.schedule().get("Monday"));
    }

    @Test
    @DisplayName("repeated resolves of the same camera are equal")
    void resolveIsIdempotent() throws Exception {
        Camera camera = TestCameras.scheduled("cam2");
        assertEquals(resolver.resolve(camera), resolver.resolve(camera));
    }

    @Test
    @DisplayName("each resolve produces a new config instance")
    void resolveProducesFreshInstances() throws Exception {
        Camera camera = TestCameras.camera("cam1");
        assertNotSame(resolver.resolve(camera), resolver.resolve(camera));
    }

    @Nested
    @DisplayName("snapshot url")
    class SnapshotUrlTests {

        @Test
        @DisplayName("falls back to the vendor default path")
        void fallsBackToVendorPath() throws Exception {
            var camera = new Camera(3L, "cam3", new Vendor("acme", "snapshot.jpg"),
                    "10.0.0.3", null, null, null, null, null, null);
            assertEquals("http://10.0.0.3/snapshot.jpg", resolver.resolve(camera).settings().url());
        }

        @Test
        @DisplayName("allows a camera without vendor and path")
        void allowsMissingPath() throws Exception {
            var camera = new Camera(4L, "cam4", null, "10.0.0.4", 81, null, null, null, null, null);
            var settings = resolver.resolve(camera).settings();
            assertEquals("http://10.0.0.4:81", settings.url());
            assertNull(settings.vendorExid());
        }

        @Test
        @DisplayName("rejects a blank host with InvalidHostException")
        void rejectsBlankHost() {
            var ex = assertThrows(InvalidHostException.class,
                    () -> resolver.resolve(TestCameras.camera("cam5", "  ")));
            assertEquals("  ", ex.getUrl());
        }

        @Test
        @DisplayName("rejects a missing host")
        void rejectsMissingHost() {
            var ex = assertThrows(InvalidHostException.class,
                    () -> resolver.resolve(TestCameras.camera("cam6", null)));
            assertEquals("", ex.getUrl());
        }

        @Test
        @DisplayName("rejects a host that does not parse, carrying the url")
        void rejectsUnparsableHost() {
            var ex = assertThrows(InvalidHostException.class,
                    () -> resolver.resolve(TestCameras.camera("cam7", "bad host")));
            assertEquals("http://bad host/live", ex.getUrl());
        }
    }

    @Nested
    @DisplayName("cloud recording derivations")
    class CloudRecordingTests {

        @Test
        @DisplayName("no cloud recording polls every second on a continuous schedule")
        void noRecording() {
            assertEquals(1_000, ConfigResolver.sleep(null));
            assertEquals(1_000, ConfigResolver.initialSleep("cam1", null));
            assertEquals(7, ConfigResolver.schedule(null).size());
        }

        @Test
        @DisplayName("recording off keeps a one second heartbeat and an empty schedule")
        void recordingOff() {
            var off = new CloudRecording(CloudRecording.STATUS_OFF, 30, Map.of("Monday", List.of("08:00-09:00")));
            assertEquals(1_000, ConfigResolver.sleep(off));
            assertEquals(1_000, ConfigResolver.initialSleep("cam1", off));
            assertTrue(ConfigResolver.schedule(off).isEmpty());
        }

        @Test
        @DisplayName("paused recording sleeps one second")
        void recordingPaused() {
            var paused = new CloudRecording(CloudRecording.STATUS_PAUSED, 30, Map.of());
            assertEquals(1_000, ConfigResolver.sleep(paused));
        }

        @Test
        @DisplayName("scheduled recording keeps its own schedule and derives sleep from frequency")
        void recordingScheduled() {
            var schedule = Map.of("Monday", List.of("08:00-18:00"));
            var scheduled = new CloudRecording(CloudRecording.STATUS_SCHEDULED, 6, schedule);
            assertEquals(10_000, ConfigResolver.sleep(scheduled));
            assertEquals(schedule, ConfigResolver.schedule(scheduled));
        }

        @Test
        @DisplayName("initial sleep is staggered between one and sixty seconds")
        void initialSleepIsStaggered() {
            var on = new CloudRecording(CloudRecording.STATUS_ON, 12, Map.of());
            for (String exid : List.of("a", "cam1", "front-door", "zzzzzzzz")) {
                long initial = ConfigResolver.initialSleep(exid, on);
                assertTrue(initial >= 1_000 && initial <= 60_000, exid + " -> " + initial);
                assertEquals(initial, ConfigResolver.initialSleep(exid, on));
            }
        }

        @Test
        @DisplayName("one frame per minute starts after one second")
        void oneFramePerMinute() {
            var slow = new CloudRecording(CloudRecording.STATUS_ON, 1, Map.of());
            assertEquals(60_000, ConfigResolver.sleep(slow));
            assertEquals(1_000, ConfigResolver.initialSleep("cam1", slow));
        }
    }

    @Test
    @DisplayName("auth joins user and password, empty when both are absent")
    void auth() throws Exception {
        assertEquals("user:", resolver.resolve(TestCameras.scheduled("cam2")).settings().auth());
        assertEquals("", resolver.resolve(TestCameras.camera("cam8", "10.0.0.8")).settings().auth());
    }

    @Test
    @DisplayName("missing timezone defaults to UTC")
    void defaultTimezone() throws Exception {
        assertEquals("Etc/UTC", resolver.resolve(TestCameras.camera("cam8", "10.0.0.8")).settings().timezone());
    }

    @Test
    @DisplayName("camera without an exid is rejected")
    void missingExid() {
        Camera anonymous = new Camera(9L, " ", null, "10.0.0.9", null, null, null, null, null, null);
        assertThrows(IllegalArgumentException.class, () -> resolver.resolve(anonymous));
    }

    @Nested
    @DisplayName("resolved schedule")
    class ResolvedScheduleTests {

        @Test
        @DisplayName("is detached from the camera record it was resolved from")
        void detachedFromInput() throws Exception {
            var monday = new ArrayList<>(List.of("08:00-18:00"));
            var days = new HashMap<String, List<String>>();
            days.put("Monday", monday);
            Camera camera = new Camera(3L, "cam3", null, "10.0.0.3", null, "/snap", null, null, null,
                    new CloudRecording(CloudRecording.STATUS_SCHEDULED, 6, days));

            WorkerConfig config = resolver.resolve(camera);
            monday.add("20:00-22:00");
            days.put("Tuesday", List.of("09:00-10:00"));

            assertEquals(Map.of("Monday", List.of("08:00-18:00")), config.settings().schedule());
        }

        @Test
        @DisplayName("cannot be modified through the config")
        void unmodifiable() throws Exception {
            var schedule = resolver.resolve(TestCameras.scheduled("cam2")).settings().schedule();

            assertThrows(UnsupportedOperationException.class, () -> schedule.get("Monday").add("20:00-22:00"));
            assertThrows(UnsupportedOperationException.class, () -> schedule.put("Sunday", List.of()));
        }

        @Test
        @DisplayName("keeps the days in week order")
        void weekOrder() throws Exception {
            var schedule = resolver.resolve(TestCameras.camera("cam1")).settings().schedule();

            assertEquals(ConfigResolver.DAYS, new ArrayList<>(schedule.keySet()));
        }
    }
}
