package com.flagship.split_ledger.balance;

import com.flagship.split_ledger.common.exception.DataIntegrityException;
import com.flagship.split_ledger.expense.Expense;
import com.flagship.split_ledger.expense.ExpenseStore;
import com.flagship.split_ledger.observability.LedgerMetrics;
import com.flagship.split_ledger.settlement.Settlement;
import com.flagship.split_ledger.settlement.SettlementStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read side of the ledger: loads a group snapshot and derives balances and
 * simplified debts on demand. Nothing here is cached or written back.
 *
 * The snapshot is read in one REPEATABLE READ transaction so expenses and
 * settlements come from the same point in time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceQueryService {

    private final ExpenseStore expenseStore;
    private final SettlementStore settlementStore;
    private final BalanceCalculator calculator;
    private final DebtSimplifier simplifier;
    private final LedgerMetrics metrics;

    /**
     * @throws DataIntegrityException if a stored record of the group breaks a ledger invariant
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public GroupBalances getGroupBalances(String groupId) {
        return metrics.timeBalanceQuery(() -> {
            List<Expense> expenses = expenseStore.listByGroup(groupId);
            List<Settlement> settlements = settlementStore.listByGroup(groupId);
            try {
                GroupBalances balances = calculator.computeGroupBalances(groupId, expenses, settlements);
                log.debug("Computed balances for group {}: {} expense(s), {} settlement(s), {} member(s)",
                        groupId, expenses.size(), settlements.size(), balances.getBalances().size());
                return balances;
            } catch (DataIntegrityException e) {
                metrics.recordIntegrityViolation();
                log.error("Balances withheld for group {}: {}", groupId, e.getViolations());
                throw e;
            }
        });
    }

    /**
     * Minimal settling transactions for one currency of the group.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<SimplifiedDebt> getSimplifiedDebts(String groupId, String currency) {
        String normalized = currency.trim().toUpperCase(Locale.ROOT);
        GroupBalances balances = getGroupBalances(groupId);
        return simplifier.simplify(normalized, balances.forCurrency(normalized));
    }

    /**
     * Simplified debts for every currency present in the group, keyed by currency.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Map<String, List<SimplifiedDebt>> getAllSimplifiedDebts(String groupId) {
        return simplifier.simplifyAll(getGroupBalances(groupId));
    }
}
