package org.endowsim.runtime.model;

/**
 * Kinds of entries in the simulation's diagnostic event log.
 */
public enum EventType {
    INIT("init"),
    NEW_PROPOSAL("new_proposal"),
    FUNDED("funded"),
    COMPLETED("completed"),
    FAILED("failed"),
    REFUND("refund"),
    EXIT("exit"),
    ENTRY("entry"),
    EXPIRY("expiry");

    private final String id;

    EventType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
