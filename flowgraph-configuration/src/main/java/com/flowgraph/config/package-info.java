/**
 * Process setup: {@link com.flowgraph.config.FlowGraphConfig} from environment variables, the Redis
 * document cache and {@link com.flowgraph.config.EngineBootstrap}.
 */
package com.flowgraph.config;
