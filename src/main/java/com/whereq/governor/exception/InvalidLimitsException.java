package com.whereq.governor.exception;

import java.util.List;

/**
 * Exception thrown when budget limits violate their invariants.
 * Raised before any state is touched.
 */
public class InvalidLimitsException extends GovernorException {
    private final List<String> violations;

    public InvalidLimitsException(List<String> violations) {
        super("Invalid budget limits: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
