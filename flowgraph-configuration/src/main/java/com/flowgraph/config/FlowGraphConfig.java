package com.flowgraph.config;

import com.flowgraph.document.load.DocumentKeyBuilder;

import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for a FlowGraph editing process.
 * <p>
 * Documents: FLOWGRAPH_CONFIG_DIR, FLOWGRAPH_DEFAULT_DOCUMENT, FLOWGRAPH_LOAD_RETRY_WAIT_SECONDS.
 * Cache: FLOWGRAPH_CACHE_ENABLED, FLOWGRAPH_CACHE_HOST, FLOWGRAPH_CACHE_PORT, FLOWGRAPH_CACHE_KEY_PREFIX.
 * Metrics: FLOWGRAPH_METRICS_ENABLED. Plugin catalog: FLOWGRAPH_CATALOG_RESOURCE.
 */
public final class FlowGraphConfig {

    static final String ENV_CONFIG_DIR = "FLOWGRAPH_CONFIG_DIR";
    static final String ENV_DEFAULT_DOCUMENT = "FLOWGRAPH_DEFAULT_DOCUMENT";
    static final String ENV_CACHE_ENABLED = "FLOWGRAPH_CACHE_ENABLED";
    static final String ENV_CACHE_HOST = "FLOWGRAPH_CACHE_HOST";
    static final String ENV_CACHE_PORT = "FLOWGRAPH_CACHE_PORT";
    static final String ENV_CACHE_KEY_PREFIX = "FLOWGRAPH_CACHE_KEY_PREFIX";
    static final String ENV_LOAD_RETRY_WAIT_SECONDS = "FLOWGRAPH_LOAD_RETRY_WAIT_SECONDS";
    static final String ENV_METRICS_ENABLED = "FLOWGRAPH_METRICS_ENABLED";
    static final String ENV_CATALOG_RESOURCE = "FLOWGRAPH_CATALOG_RESOURCE";

    private static final String DEFAULT_CONFIG_DIR = "config";
    private static final String DEFAULT_DOCUMENT = "default";
    private static final String DEFAULT_CACHE_HOST = "localhost";
    private static final int DEFAULT_CACHE_PORT = 6379;
    /** 0 fails fast when no document is found; editors usually start from an empty document instead. */
    private static final int DEFAULT_LOAD_RETRY_WAIT_SECONDS = 0;

    private final String configDir;
    private final String defaultDocument;
    private final boolean cacheEnabled;
    private final String cacheHost;
    private final int cachePort;
    private final String cacheKeyPrefix;
    private final int loadRetryWaitSeconds;
    private final boolean metricsEnabled;
    private final String catalogResource;

    private FlowGraphConfig(Builder b) {
        this.configDir = b.configDir;
        this.defaultDocument = b.defaultDocument;
        this.cacheEnabled = b.cacheEnabled;
        this.cacheHost = b.cacheHost;
        this.cachePort = b.cachePort;
        this.cacheKeyPrefix = b.cacheKeyPrefix;
        this.loadRetryWaitSeconds = Math.max(0, b.loadRetryWaitSeconds);
        this.metricsEnabled = b.metricsEnabled;
        this.catalogResource = b.catalogResource;
    }

    /** Directory holding {@code <name>.json} documents. Default {@code config}. */
    public String getConfigDir() {
        return configDir;
    }

    /** Document loaded at startup. Default {@code default}. */
    public String getDefaultDocument() {
        return defaultDocument;
    }

    /** Whether documents are also read from and written to Redis. Default false. */
    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public String getCacheHost() {
        return cacheHost;
    }

    public int getCachePort() {
        return cachePort;
    }

    /** Redis key prefix; keys are {@code <prefix>:<document name>}. */
    public String getCacheKeyPrefix() {
        return cacheKeyPrefix;
    }

    /** Seconds to wait before retrying the startup load when no document is found. 0 = fail fast. */
    public int getLoadRetryWaitSeconds() {
        return loadRetryWaitSeconds;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    /** Classpath resource with the plugin catalog (JSON array of descriptors); null = empty catalog. */
    public String getCatalogResource() {
        return catalogResource;
    }

    public static FlowGraphConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Reads the variables from {@code env}; blank or unparseable values fall back to defaults. */
    public static FlowGraphConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .configDir(get(env, ENV_CONFIG_DIR, DEFAULT_CONFIG_DIR))
                .defaultDocument(get(env, ENV_DEFAULT_DOCUMENT, DEFAULT_DOCUMENT))
                .cacheEnabled(parseBoolean(env.get(ENV_CACHE_ENABLED), false))
                .cacheHost(get(env, ENV_CACHE_HOST, DEFAULT_CACHE_HOST))
                .cachePort(parseInt(env.get(ENV_CACHE_PORT), DEFAULT_CACHE_PORT))
                .cacheKeyPrefix(get(env, ENV_CACHE_KEY_PREFIX, DocumentKeyBuilder.DEFAULT_PREFIX))
                .loadRetryWaitSeconds(parseInt(env.get(ENV_LOAD_RETRY_WAIT_SECONDS), DEFAULT_LOAD_RETRY_WAIT_SECONDS))
                .metricsEnabled(parseBoolean(env.get(ENV_METRICS_ENABLED), true))
                .catalogResource(get(env, ENV_CATALOG_RESOURCE, null))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "FlowGraphConfig{configDir=" + configDir + ", defaultDocument=" + defaultDocument
                + ", cacheEnabled=" + cacheEnabled + ", cache=" + cacheHost + ":" + cachePort
                + ", cacheKeyPrefix=" + cacheKeyPrefix + ", loadRetryWaitSeconds=" + loadRetryWaitSeconds
                + ", metricsEnabled=" + metricsEnabled + ", catalogResource=" + catalogResource + "}";
    }

    public static final class Builder {
        private String configDir = DEFAULT_CONFIG_DIR;
        private String defaultDocument = DEFAULT_DOCUMENT;
        private boolean cacheEnabled;
        private String cacheHost = DEFAULT_CACHE_HOST;
        private int cachePort = DEFAULT_CACHE_PORT;
        private String cacheKeyPrefix = DocumentKeyBuilder.DEFAULT_PREFIX;
        private int loadRetryWaitSeconds = DEFAULT_LOAD_RETRY_WAIT_SECONDS;
        private boolean metricsEnabled = true;
        private String catalogResource;

        public Builder configDir(String configDir) {
            this.configDir = configDir != null ? configDir : DEFAULT_CONFIG_DIR;
            return this;
        }

        public Builder defaultDocument(String defaultDocument) {
            this.defaultDocument = defaultDocument != null ? defaultDocument : DEFAULT_DOCUMENT;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder cacheHost(String cacheHost) {
            this.cacheHost = Objects.requireNonNull(cacheHost, "cacheHost");
            return this;
        }

        public Builder cachePort(int cachePort) {
            this.cachePort = cachePort;
            return this;
        }

        public Builder cacheKeyPrefix(String cacheKeyPrefix) {
            this.cacheKeyPrefix = cacheKeyPrefix != null ? cacheKeyPrefix : DocumentKeyBuilder.DEFAULT_PREFIX;
            return this;
        }

        public Builder loadRetryWaitSeconds(int loadRetryWaitSeconds) {
            this.loadRetryWaitSeconds = loadRetryWaitSeconds;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public Builder catalogResource(String catalogResource) {
            this.catalogResource = catalogResource;
            return this;
        }

        public FlowGraphConfig build() {
            return new FlowGraphConfig(this);
        }
    }
}
