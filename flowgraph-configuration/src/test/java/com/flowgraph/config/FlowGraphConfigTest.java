package com.flowgraph.config;

import com.flowgraph.document.load.DocumentKeyBuilder;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FlowGraphConfigTest {

    @Test
    void defaultsWhenEnvironmentIsEmpty() {
        FlowGraphConfig config = FlowGraphConfig.fromEnvironment(Map.of());

        assertEquals("config", config.getConfigDir());
        assertEquals("default", config.getDefaultDocument());
        assertFalse(config.isCacheEnabled());
        assertEquals("localhost", config.getCacheHost());
        assertEquals(6379, config.getCachePort());
        assertEquals(DocumentKeyBuilder.DEFAULT_PREFIX, config.getCacheKeyPrefix());
        assertEquals(0, config.getLoadRetryWaitSeconds());
        assertTrue(config.isMetricsEnabled());
        assertNull(config.getCatalogResource());
    }

    @Test
    void readsEveryVariable() {
        FlowGraphConfig config = FlowGraphConfig.fromEnvironment(Map.of(
                "FLOWGRAPH_CONFIG_DIR", "/etc/flowgraph",
                "FLOWGRAPH_DEFAULT_DOCUMENT", "digest",
                "FLOWGRAPH_CACHE_ENABLED", "TRUE",
                "FLOWGRAPH_CACHE_HOST", "redis.internal",
                "FLOWGRAPH_CACHE_PORT", "6380",
                "FLOWGRAPH_CACHE_KEY_PREFIX", "fg:doc",
                "FLOWGRAPH_LOAD_RETRY_WAIT_SECONDS", "5",
                "FLOWGRAPH_METRICS_ENABLED", "false",
                "FLOWGRAPH_CATALOG_RESOURCE", "catalog.json"));

        assertEquals("/etc/flowgraph", config.getConfigDir());
        assertEquals("digest", config.getDefaultDocument());
        assertTrue(config.isCacheEnabled());
        assertEquals("redis.internal", config.getCacheHost());
        assertEquals(6380, config.getCachePort());
        assertEquals("fg:doc", config.getCacheKeyPrefix());
        assertEquals(5, config.getLoadRetryWaitSeconds());
        assertFalse(config.isMetricsEnabled());
        assertEquals("catalog.json", config.getCatalogResource());
    }

    @Test
    void blankAndInvalidValuesFallBackToDefaults() {
        FlowGraphConfig config = FlowGraphConfig.fromEnvironment(Map.of(
                "FLOWGRAPH_CONFIG_DIR", "  ",
                "FLOWGRAPH_CACHE_PORT", "not-a-port",
                "FLOWGRAPH_CACHE_ENABLED", "yes please",
                "FLOWGRAPH_LOAD_RETRY_WAIT_SECONDS", "-3"));

        assertEquals("config", config.getConfigDir());
        assertEquals(6379, config.getCachePort());
        assertFalse(config.isCacheEnabled());
        assertEquals(0, config.getLoadRetryWaitSeconds());
    }

    @Test
    void builderNullsMeanDefaults() {
        FlowGraphConfig config = FlowGraphConfig.builder()
                .configDir(null)
                .defaultDocument(null)
                .cacheKeyPrefix(null)
                .build();

        assertEquals("config", config.getConfigDir());
        assertEquals("default", config.getDefaultDocument());
        assertEquals(DocumentKeyBuilder.DEFAULT_PREFIX, config.getCacheKeyPrefix());
    }
}
