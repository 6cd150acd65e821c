package com.snapkeeper.core.catalog;

/**
 * Thrown when the camera catalog cannot be reached or read.
 */
public class CatalogUnavailableException extends RuntimeException {

    public CatalogUnavailableException(String message) {
        super(message);
    }

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
