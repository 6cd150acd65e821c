package com.snapkeeper.worker;

import com.snapkeeper.core.model.CameraSettings;

/**
 * Fetches one JPEG from a camera.
 */
public interface SnapshotFetcher {

    /**
     * @param settings the camera's current settings
     * @return the image bytes
     * @throws SnapshotException when the camera did not return an image
     */
    byte[] fetch(CameraSettings settings) throws SnapshotException;
}
