/**
 * Agent swarm source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentswarm.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentswarm.cli.SwarmCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.agentswarm.eventlog.EventLog} persists events and routes them to subscribed agents.</li>
 *   <li>{@code io.agentswarm.runner.AgentRunner} gates triggers and runs agent turns.</li>
 *   <li>{@code io.agentswarm.swarm.Reconciler} keeps the agent registry in line with discovered units.</li>
 * </ul>
 */
package io.agentswarm;
