package de.bsommerfeld.drydock.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each section maps to one sub-config; missing
 * sections and keys keep their defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DryDockConfig {

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("sync")
    private SyncConfig sync = new SyncConfig();

    @JsonProperty("assistant")
    private AssistantConfig assistant = new AssistantConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public SyncConfig getSync() {
        return sync;
    }

    public AssistantConfig getAssistant() {
        return assistant;
    }
}
