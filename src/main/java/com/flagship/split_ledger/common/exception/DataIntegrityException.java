package com.flagship.split_ledger.common.exception;

import lombok.Getter;

import java.util.List;

/**
 * A stored record violates a ledger invariant at read time.
 *
 * Write-time validation should make this unreachable; seeing it points to a
 * migration or programming bug. The error is scoped to one group: balances of
 * other groups are unaffected.
 */
@Getter
public class DataIntegrityException extends RuntimeException {

    private final String groupId;
    private final List<String> violations;

    public DataIntegrityException(String groupId, List<String> violations) {
        super(String.format("Group %s has %d record(s) violating ledger invariants: %s",
                groupId, violations.size(), violations));
        this.groupId = groupId;
        this.violations = List.copyOf(violations);
    }
}
