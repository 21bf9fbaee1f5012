package de.bsommerfeld.drydock.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Feed sync parameters. The interval is read once at startup and cannot be
 * changed while the scheduler runs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncConfig {

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

    @JsonProperty("interval-seconds")
    private long intervalSeconds = 300;

    @JsonProperty("http-timeout-seconds")
    private long httpTimeoutSeconds = 30;

    @JsonProperty("max-redirects")
    private int maxRedirects = 10;

    @JsonProperty("user-agent")
    private String userAgent = DEFAULT_USER_AGENT;

    public long getIntervalSeconds() {
        return intervalSeconds;
    }

    public long getHttpTimeoutSeconds() {
        return httpTimeoutSeconds;
    }

    public int getMaxRedirects() {
        return maxRedirects;
    }

    public String getUserAgent() {
        return userAgent;
    }
}
