/**
 * SteadyLoop source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.steadyloop.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.steadyloop.cli.SteadyLoopCommand} maps commands to engine calls.</li>
 *   <li>{@code io.steadyloop.runtime.SteadyLoopEngine} wires the queue, retry, budget and degradation layers.</li>
 *   <li>{@code io.steadyloop.storage.TaskStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.steadyloop;
