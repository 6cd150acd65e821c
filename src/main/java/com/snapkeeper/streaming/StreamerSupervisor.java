package com.snapkeeper.streaming;

/**
 * Live-stream subsystem that must follow camera reconfiguration.
 */
public interface StreamerSupervisor {

    /**
     * Restarts the live stream of a camera. Fire-and-forget for callers.
     *
     * @param cameraExid the camera whose stream to restart
     */
    void restartStreamer(String cameraExid);
}
