package com.flagship.split_ledger.balance;

import com.flagship.split_ledger.common.exception.DataIntegrityException;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of aggregating a ledger snapshot that may span several groups.
 *
 * A group appears either in {@code balances} or in {@code violations}, never
 * both: a group holding a corrupt record has its balances withheld.
 */
@Value
public class BalanceSheet {
    Map<String, GroupBalances> balances;
    Map<String, List<String>> violations;

    /**
     * @throws DataIntegrityException if the group's records failed validation
     */
    public GroupBalances forGroup(String groupId) {
        List<String> groupViolations = violations.get(groupId);
        if (groupViolations != null) {
            throw new DataIntegrityException(groupId, groupViolations);
        }
        return balances.getOrDefault(groupId, GroupBalances.empty(groupId));
    }

    public boolean hasViolations(String groupId) {
        return violations.containsKey(groupId);
    }
}
