/**
 * Runtime wiring package.
 *
 * <p>{@link io.agentswarm.runtime.SwarmRuntime} opens the event log, subscription registry,
 * swarm registry and agent state store under one storage root, and builds the reconciler and
 * agent runner on top of them for the CLI and embedding callers.
 */
package io.agentswarm.runtime;
