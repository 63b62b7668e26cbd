package com.flagship.split_ledger.balance;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Collapses a currency's net balances into a short list of payments.
 *
 * Greedy matching: the largest creditor is paired with the largest debtor
 * (by magnitude), the smaller of the two amounts is paid, and whoever reaches
 * zero drops out. Every step retires at least one member and the last step
 * retires two, so N non-zero members need at most N - 1 payments.
 *
 * Ties are broken by the lower member id, which keeps the output stable for
 * equal inputs. Currencies are never mixed.
 */
@Component
public class DebtSimplifier {

    private static final Comparator<Party> LARGEST_FIRST = Comparator
            .comparingLong(Party::getRemaining).reversed()
            .thenComparing(Party::getMemberId);

    /**
     * @param currency  currency every balance is expressed in
     * @param balances  member -> signed net balance; must sum to zero
     * @return payments that bring every balance to zero, in emission order
     * @throws UnbalancedBalancesException if the balances do not sum to zero
     */
    public List<SimplifiedDebt> simplify(String currency, Map<String, Long> balances) {
        long residue = 0L;
        PriorityQueue<Party> creditors = new PriorityQueue<>(LARGEST_FIRST);
        PriorityQueue<Party> debtors = new PriorityQueue<>(LARGEST_FIRST);

        for (Map.Entry<String, Long> entry : balances.entrySet()) {
            long balance = entry.getValue();
            residue = Math.addExact(residue, balance);
            if (balance > 0) {
                creditors.add(new Party(entry.getKey(), balance));
            } else if (balance < 0) {
                debtors.add(new Party(entry.getKey(), -balance));
            }
        }
        if (residue != 0L) {
            throw new UnbalancedBalancesException(currency, residue);
        }

        List<SimplifiedDebt> debts = new ArrayList<>();
        while (!creditors.isEmpty() && !debtors.isEmpty()) {
            Party creditor = creditors.poll();
            Party debtor = debtors.poll();
            long amount = Math.min(creditor.getRemaining(), debtor.getRemaining());

            debts.add(new SimplifiedDebt(debtor.getMemberId(), creditor.getMemberId(), amount, currency));

            if (creditor.getRemaining() > amount) {
                creditors.add(new Party(creditor.getMemberId(), creditor.getRemaining() - amount));
            }
            if (debtor.getRemaining() > amount) {
                debtors.add(new Party(debtor.getMemberId(), debtor.getRemaining() - amount));
            }
        }
        return debts;
    }

    /**
     * Simplifies every currency of a group independently.
     *
     * @return currency -> payments, currencies in ascending order
     */
    public Map<String, List<SimplifiedDebt>> simplifyAll(GroupBalances groupBalances) {
        Map<String, List<SimplifiedDebt>> result = new LinkedHashMap<>();
        for (String currency : groupBalances.currencies()) {
            result.put(currency, simplify(currency, groupBalances.forCurrency(currency)));
        }
        return result;
    }

    @Value
    private static class Party {
        String memberId;
        long remaining;
    }
}
