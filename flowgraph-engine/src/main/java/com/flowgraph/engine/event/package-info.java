/**
 * Engine notifications: event kinds, payload types and the listener/subscription handles.
 */
package com.flowgraph.engine.event;
