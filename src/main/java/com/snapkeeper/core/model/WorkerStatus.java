package com.snapkeeper.core.model;

/**
 * Lifecycle status of a supervised camera worker.
 */
public enum WorkerStatus {
    STARTING,
    RUNNING,
    CRASHED,
    RESTARTING,
    STOPPED     // Terminal, the handle is removed from the registry
}
