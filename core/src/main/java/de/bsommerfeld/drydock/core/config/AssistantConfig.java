package de.bsommerfeld.drydock.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Local Ollama server used by the assistant chat.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssistantConfig {

    @JsonProperty("base-url")
    private String baseUrl = "http://localhost:11434";

    @JsonProperty("model")
    private String model = "gemma3";

    @JsonProperty("timeout-seconds")
    private long timeoutSeconds = 60;

    @JsonProperty("status-timeout-seconds")
    private long statusTimeoutSeconds = 2;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public long getStatusTimeoutSeconds() {
        return statusTimeoutSeconds;
    }
}
