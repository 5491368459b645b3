/**
 * Daemon lifecycle and request flow.
 *
 * <p>{@link io.bridged.runtime.BridgeDaemon} builds everything once. Requests enter through
 * the transport, pass {@link io.bridged.runtime.Dispatcher} (authorization, then input
 * validation, then the registered operation) and always come back as a response envelope.
 * {@link io.bridged.runtime.StaleReaper} runs on the daemon scheduler and evicts handles whose
 * idle time exceeds the configured threshold for their kind.
 */
package io.bridged.runtime;
