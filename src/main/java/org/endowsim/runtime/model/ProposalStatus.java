package org.endowsim.runtime.model;

/**
 * Lifecycle states of a proposal. Transitions only move forward:
 * {@code OPEN -> FUNDED -> COMPLETED | FAILED}.
 */
public enum ProposalStatus {
    OPEN("open"),
    FUNDED("funded"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String id;

    ProposalStatus(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * @return true for the terminal states
     */
    public boolean isResolved() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * @return true once the funding target has been reached
     */
    public boolean isFunded() {
        return this != OPEN;
    }
}
