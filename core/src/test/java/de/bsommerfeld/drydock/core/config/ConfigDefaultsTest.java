package de.bsommerfeld.drydock.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDefaultsTest {

    @Test
    void dryDockConfig_shouldInitializeWithDefaults() {
        var config = new DryDockConfig();

        assertNotNull(config.getDatabase());
        assertNotNull(config.getSync());
        assertNotNull(config.getAssistant());
    }

    @Test
    void syncConfig_shouldMatchDocumentedCadenceAndHttpLimits() {
        var config = new SyncConfig();

        assertEquals(300, config.getIntervalSeconds());
        assertEquals(30, config.getHttpTimeoutSeconds());
        assertEquals(10, config.getMaxRedirects());
        assertTrue(config.getUserAgent().startsWith("Mozilla/5.0"));
    }

    @Test
    void databaseConfig_shouldBoundPoolToTenHandles() {
        var config = new DatabaseConfig();

        assertEquals("database.db", config.getFileName());
        assertEquals(10, config.getMaxPoolSize());
        assertEquals(30_000, config.getAcquireTimeoutMillis());
    }

    @Test
    void assistantConfig_shouldPointAtLocalOllama() {
        var config = new AssistantConfig();

        assertEquals("http://localhost:11434", config.getBaseUrl());
        assertEquals("gemma3", config.getModel());
        assertEquals(60, config.getTimeoutSeconds());
        assertEquals(2, config.getStatusTimeoutSeconds());
    }
}
