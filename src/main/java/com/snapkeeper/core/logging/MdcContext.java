package com.snapkeeper.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Snapkeeper-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String CAMERA_EXID = "cameraExid";

    private MdcContext() {}

    public static void setCamera(String cameraExid) {
        MDC.put(CAMERA_EXID, cameraExid);
    }

    public static void clear() {
        MDC.remove(CAMERA_EXID);
    }
}
