package com.snapkeeper.core.model;

/**
 * Camera manufacturer.
 *
 * @param exid                vendor external id (e.g. "hikvision")
 * @param defaultSnapshotPath JPEG path used when the camera has none of its own
 */
public record Vendor(String exid, String defaultSnapshotPath) {}
