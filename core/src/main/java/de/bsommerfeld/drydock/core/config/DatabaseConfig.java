package de.bsommerfeld.drydock.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Embedded store settings. Values are read once at startup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseConfig {

    @JsonProperty("file-name")
    private String fileName = "database.db";

    @JsonProperty("max-pool-size")
    private int maxPoolSize = 10;

    @JsonProperty("acquire-timeout-millis")
    private long acquireTimeoutMillis = 30_000;

    @JsonProperty("busy-timeout-millis")
    private int busyTimeoutMillis = 5_000;

    public String getFileName() {
        return fileName;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public void setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }

    public long getAcquireTimeoutMillis() {
        return acquireTimeoutMillis;
    }

    public void setAcquireTimeoutMillis(long acquireTimeoutMillis) {
        this.acquireTimeoutMillis = acquireTimeoutMillis;
    }

    public int getBusyTimeoutMillis() {
        return busyTimeoutMillis;
    }
}
