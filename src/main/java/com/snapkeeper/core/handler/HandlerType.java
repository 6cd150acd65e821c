package com.snapkeeper.core.handler;

/**
 * Side-effect capabilities a worker's events can be delivered to.
 * Which ones are active, and in which order, is decided by
 * {@code snapkeeper.workers.handlers} at startup.
 */
public enum HandlerType {
    BROADCAST,
    CACHE,
    PERSISTENCE,
    POLL_CONTROL,
    STORAGE,
    STATS,
    MOTION_DETECTION
}
