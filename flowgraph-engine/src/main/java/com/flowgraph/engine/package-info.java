/**
 * Graph/config synchronization engine.
 *
 * <ul>
 *   <li>{@link com.flowgraph.engine.GraphConfigEngine} – one editing session: load, edit, text path, events, save</li>
 *   <li>{@link com.flowgraph.engine.rebuild.Rebuilder} – document to graph, deterministic layout</li>
 *   <li>{@link com.flowgraph.engine.sync.Synchronizer} – graph edits folded back into the document</li>
 *   <li>{@link com.flowgraph.engine.sync.ConsistencySweep} – ports, stale connections, derived params</li>
 *   <li>{@link com.flowgraph.engine.reference.ReferenceResolver} – reference values to entries and back</li>
 * </ul>
 */
package com.flowgraph.engine;
