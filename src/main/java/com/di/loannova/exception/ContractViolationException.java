package com.di.loannova.exception;

import com.di.loannova.contract.Violation;

import java.util.List;

/**
 * Raised when a dataset breaks its schema contract.
 *
 * <p>{@code critical} violations (missing core columns, future-dated records, a
 * malformed contract) always halt ingestion; non-critical ones halt only in strict mode.
 */
public class ContractViolationException extends PipelineException {

    private final List<Violation> violations;
    private final boolean         critical;

    public ContractViolationException(String message, List<Violation> violations, boolean critical) {
        super(message);
        this.violations = List.copyOf(violations);
        this.critical   = critical;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public boolean isCritical() {
        return critical;
    }
}
