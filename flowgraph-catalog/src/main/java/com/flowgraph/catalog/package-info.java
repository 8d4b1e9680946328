/**
 * Plugin catalog: descriptors by role, structural parameter checks and dependency auto-wiring.
 *
 * <ul>
 *   <li>{@link com.flowgraph.catalog.PluginCatalog} – {@code listPlugins()};
 *       {@link com.flowgraph.catalog.InMemoryPluginCatalog} (register, JSON/resource loading)</li>
 *   <li>{@link com.flowgraph.catalog.ParameterShapeValidator} – required/type checks, warnings only</li>
 *   <li>{@link com.flowgraph.catalog.DependencyResolver} – provider/storage needs of a new plugin</li>
 * </ul>
 */
package com.flowgraph.catalog;
