package com.snapkeeper.core.catalog;

import com.snapkeeper.core.model.Camera;

import java.util.List;

/**
 * Source of the cameras Snapkeeper runs workers for.
 */
public interface CameraCatalog {

    /**
     * Lists every camera.
     *
     * @throws CatalogUnavailableException when the catalog cannot be read
     */
    List<Camera> listAll();
}
