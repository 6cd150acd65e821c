package com.snapkeeper.core.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snapkeeper.core.model.Camera;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the camera catalog from a JSON array on disk.
 * <p>
 * The file is re-read on every {@link #listAll()} call so edits are picked up
 * by the next bulk start without a restart.
 */
public class JsonFileCameraCatalog implements CameraCatalog {

    private static final Logger log = LoggerFactory.getLogger(JsonFileCameraCatalog.class);

    private static final TypeReference<List<Camera>> CAMERA_LIST = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileCameraCatalog(Path file) {
        this.file = file;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public List<Camera> listAll() {
        if (!Files.isRegularFile(file)) {
            throw new CatalogUnavailableException("Camera catalog not found: " + file.toAbsolutePath());
        }
        try {
            List<Camera> cameras = objectMapper.readValue(file.toFile(), CAMERA_LIST);
            if (cameras == null) {
                return List.of();
            }
            log.debug("Read {} cameras from {}", cameras.size(), file);
            return cameras;
        } catch (IOException e) {
            throw new CatalogUnavailableException("Failed to read camera catalog " + file + ": " + e.getMessage(), e);
        }
    }
}
