package com.snapkeeper.streaming;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stand-in used when no streaming subsystem is deployed alongside Snapkeeper.
 */
public class LoggingStreamerSupervisor implements StreamerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(LoggingStreamerSupervisor.class);

    @Override
    public void restartStreamer(String cameraExid) {
        log.info("[{}] No streaming subsystem configured, skipping streamer restart", cameraExid);
    }
}
