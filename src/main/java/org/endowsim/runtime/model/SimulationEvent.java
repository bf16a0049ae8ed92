package org.endowsim.runtime.model;

/**
 * One entry of the append-only event log.
 *
 * @param step the step during which the event happened
 * @param type the event kind
 * @param message human-readable description
 */
public record SimulationEvent(long step, EventType type, String message) {}
