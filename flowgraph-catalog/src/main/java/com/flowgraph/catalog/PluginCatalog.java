package com.flowgraph.catalog;

/**
 * Source of installable plugin descriptions. Used for parameter shape checks and dependency
 * auto-wiring only; the catalog never takes part in graph/document reconciliation.
 */
public interface PluginCatalog {

    CategorizedPluginDescriptors listPlugins();
}
