/**
 * Runnable monitor service: wires the correlation engine to the Hyperliquid
 * info API, a Kafka or log alert sink, a JSON rule store and the health
 * endpoints.
 *
 * <p>
 * Entry point: {@link com.confluencesentinel.monitor.ConfluenceMonitorApp}.
 * </p>
 */
package com.confluencesentinel.monitor;
