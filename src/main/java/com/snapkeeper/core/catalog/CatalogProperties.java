package com.snapkeeper.core.catalog;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "snapkeeper.catalog")
public class CatalogProperties {

    /** JSON file holding an array of cameras. */
    private String file = "cameras.json";

    public String getFile() { return file; }
    public void setFile(String file) { this.file = file; }
}
