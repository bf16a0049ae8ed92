package org.endowsim.runtime.config;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * What happens to backers' credits when a funded proposal fails.
 */
public enum FailureMode {
    /** Contributed credits are lost. */
    NOTHING("nothing"),
    /** Active backers get half of their contribution back as credits. */
    PARTIAL_REFUND("partial_refund");

    private final String id;

    FailureMode(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * @param id configuration id, e.g. {@code "partial_refund"}
     * @return the matching mode
     * @throws IllegalArgumentException if the id is unknown, naming the valid ids
     */
    public static FailureMode fromId(String id) {
        for (FailureMode mode : values()) {
            if (mode.id.equals(id)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown failure mode: " + id + ". Available: " + ids());
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(FailureMode::id).collect(Collectors.toList());
    }
}
