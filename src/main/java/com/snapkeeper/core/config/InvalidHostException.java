package com.snapkeeper.core.config;

/**
 * Thrown when no usable snapshot URL can be derived for a camera.
 */
public class InvalidHostException extends Exception {

    private final String url;

    public InvalidHostException(String url) {
        super("Invalid camera host: " + url);
        this.url = url;
    }

    /** The offending URL (or host) value. */
    public String getUrl() {
        return url;
    }
}
