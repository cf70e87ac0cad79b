package com.folio.backend.exception;

import java.util.List;

public class AllocationInvalidException extends RuntimeException {
    private final List<String> violations;

    public AllocationInvalidException(List<String> violations) {
        super("Allocation rejected: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
