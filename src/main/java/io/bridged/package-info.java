/**
 * bridged source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.bridged.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.bridged.runtime.BridgeDaemon} wires the pool, metrics, registry, reaper and listener.</li>
 *   <li>{@code io.bridged.transport.TransportListener} owns the Unix socket and per-connection timeouts.</li>
 *   <li>{@code io.bridged.runtime.Dispatcher} runs authorize, validate, execute for every request.</li>
 *   <li>{@code io.bridged.pool.HandlePool} is the only owner of long-lived native resources.</li>
 * </ul>
 */
package io.bridged;
