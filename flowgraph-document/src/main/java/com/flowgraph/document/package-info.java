/**
 * Pipeline configuration document: role arrays of plugin entries plus settings.
 *
 * <ul>
 *   <li>{@link com.flowgraph.document.model.ConfigDocument} – immutable root; {@code with*} methods copy on write</li>
 *   <li>{@link com.flowgraph.document.model.PluginEntry} – one plugin record; {@code provider}/{@code storage}
 *       params name {@code ai}/{@code storage} entries</li>
 *   <li>{@link com.flowgraph.document.DocumentJson} – JSON codec and text parsing with positions</li>
 *   <li>{@link com.flowgraph.document.load.DocumentLoader} – cache → {@code <name>.json} → {@code default.json}</li>
 *   <li>{@link com.flowgraph.document.store.DocumentStore} – load/save by name</li>
 * </ul>
 */
package com.flowgraph.document;
