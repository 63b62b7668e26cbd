package com.flagship.split_ledger.balance;

import com.flagship.split_ledger.expense.Expense;
import com.flagship.split_ledger.expense.ExpenseSplit;
import com.flagship.split_ledger.settlement.Settlement;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Derives net balances from a ledger snapshot.
 *
 * Balances are derived, never stored: this is a pure function of its input
 * with no I/O and no shared state, safe to call from any number of threads.
 * All arithmetic is on {@code long} minor units.
 *
 * Rules per record:
 * - Expense: payer += amount, each split member -= split amount
 * - Settlement: payer += amount (debt paid down), payee -= amount (claim consumed)
 *
 * Deleted records are skipped. A group whose snapshot contains an expense
 * whose splits do not sum to its amount is reported in the violations of the
 * resulting {@link BalanceSheet} and its balances are withheld.
 */
@Component
public class BalanceCalculator {

    /**
     * Aggregates records of any number of groups.
     */
    public BalanceSheet computeBalances(Collection<Expense> expenses, Collection<Settlement> settlements) {
        Map<String, List<String>> violations = new TreeMap<>();
        Map<String, Map<String, SortedMap<String, Long>>> accumulators = new LinkedHashMap<>();

        for (Expense expense : expenses) {
            if (expense.isDeleted()) {
                continue;
            }
            String violation = checkExpense(expense);
            if (violation != null) {
                violations.computeIfAbsent(expense.getGroupId(), g -> new ArrayList<>()).add(violation);
                continue;
            }
            Map<String, SortedMap<String, Long>> group = accumulator(accumulators, expense.getGroupId());
            credit(group, expense.getPayerId(), expense.getCurrency(), expense.getAmount());
            for (ExpenseSplit split : expense.getSplits()) {
                credit(group, split.getMemberId(), expense.getCurrency(), -split.getAmount());
            }
        }

        for (Settlement settlement : settlements) {
            if (settlement.isDeleted()) {
                continue;
            }
            String violation = checkSettlement(settlement);
            if (violation != null) {
                violations.computeIfAbsent(settlement.getGroupId(), g -> new ArrayList<>()).add(violation);
                continue;
            }
            Map<String, SortedMap<String, Long>> group = accumulator(accumulators, settlement.getGroupId());
            credit(group, settlement.getPayerId(), settlement.getCurrency(), settlement.getAmount());
            credit(group, settlement.getPayeeId(), settlement.getCurrency(), -settlement.getAmount());
        }

        Map<String, GroupBalances> balances = new TreeMap<>();
        accumulators.forEach((groupId, members) -> {
            if (!violations.containsKey(groupId)) {
                balances.put(groupId, freeze(groupId, members));
            }
        });
        return new BalanceSheet(Collections.unmodifiableMap(balances), Collections.unmodifiableMap(violations));
    }

    /**
     * Aggregates the records of a single group.
     *
     * @throws com.flagship.split_ledger.common.exception.DataIntegrityException
     *         if a record of the group breaks a ledger invariant
     */
    public GroupBalances computeGroupBalances(String groupId, Collection<Expense> expenses,
                                              Collection<Settlement> settlements) {
        return computeBalances(expenses, settlements).forGroup(groupId);
    }

    private static String checkExpense(Expense expense) {
        if (expense.getAmount() <= 0) {
            return String.format("expense %s has non-positive amount %d", expense.getId(), expense.getAmount());
        }
        if (expense.getSplits() == null || expense.getSplits().isEmpty()) {
            return String.format("expense %s has no splits", expense.getId());
        }
        long splitTotal = expense.splitTotal();
        if (splitTotal != expense.getAmount()) {
            return String.format("expense %s splits sum to %d but amount is %d",
                    expense.getId(), splitTotal, expense.getAmount());
        }
        return null;
    }

    private static String checkSettlement(Settlement settlement) {
        if (settlement.getAmount() <= 0) {
            return String.format("settlement %s has non-positive amount %d",
                    settlement.getId(), settlement.getAmount());
        }
        return null;
    }

    private static Map<String, SortedMap<String, Long>> accumulator(
            Map<String, Map<String, SortedMap<String, Long>>> accumulators, String groupId) {
        return accumulators.computeIfAbsent(groupId, g -> new TreeMap<>());
    }

    private static void credit(Map<String, SortedMap<String, Long>> group, String memberId,
                               String currency, long amount) {
        group.computeIfAbsent(memberId, m -> new TreeMap<>())
                .merge(currency, amount, Math::addExact);
    }

    private static GroupBalances freeze(String groupId, Map<String, SortedMap<String, Long>> members) {
        SortedMap<String, SortedMap<String, Long>> frozen = new TreeMap<>();
        members.forEach((memberId, byCurrency) ->
                frozen.put(memberId, Collections.unmodifiableSortedMap(new TreeMap<>(byCurrency))));
        return new GroupBalances(groupId, Collections.unmodifiableSortedMap(frozen));
    }
}
