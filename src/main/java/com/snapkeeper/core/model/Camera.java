package com.snapkeeper.core.model;

/**
 * A network camera as read from the camera catalog.
 *
 * @param id               catalog primary key
 * @param exid             external id, used as the worker name
 * @param vendor           camera vendor (nullable)
 * @param externalHost     host or IP the snapshot endpoint is reachable on
 * @param externalHttpPort HTTP port (nullable for the scheme default)
 * @param snapshotPath     camera-specific snapshot path (nullable, falls back to the vendor default)
 * @param username         basic auth user (nullable)
 * @param password         basic auth password (nullable)
 * @param timezone         IANA timezone id (nullable)
 * @param cloudRecording   cloud recording settings (nullable when never configured)
 */
public record Camera(
    long id,
    String exid,
    Vendor vendor,
    String externalHost,
    Integer externalHttpPort,
    String snapshotPath,
    String username,
    String password,
    String timezone,
    CloudRecording cloudRecording
) {

    public String vendorExid() {
        return vendor != null ? vendor.exid() : null;
    }
}
