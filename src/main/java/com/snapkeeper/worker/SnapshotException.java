package com.snapkeeper.worker;

/**
 * A single snapshot could not be fetched. Expected for flaky cameras; the
 * worker reports it and keeps polling.
 */
public class SnapshotException extends Exception {

    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
