package com.flagship.split_ledger.balance;

import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Net balances of one group: member -> currency -> signed minor units.
 *
 * Positive means the group owes the member; negative means the member owes.
 * Maps are sorted by member id and currency so two computations over the
 * same snapshot compare equal and serialize identically.
 */
@Value
public class GroupBalances {
    String groupId;
    SortedMap<String, SortedMap<String, Long>> balances;

    public static GroupBalances empty(String groupId) {
        return new GroupBalances(groupId, Collections.emptySortedMap());
    }

    public long balanceOf(String memberId, String currency) {
        Map<String, Long> byCurrency = balances.get(memberId);
        if (byCurrency == null) {
            return 0L;
        }
        return byCurrency.getOrDefault(currency, 0L);
    }

    public Set<String> currencies() {
        Set<String> currencies = new TreeSet<>();
        balances.values().forEach(byCurrency -> currencies.addAll(byCurrency.keySet()));
        return currencies;
    }

    /**
     * Column view for one currency: member -> balance. Members without an
     * entry in that currency are absent.
     */
    public SortedMap<String, Long> forCurrency(String currency) {
        SortedMap<String, Long> column = new TreeMap<>();
        balances.forEach((memberId, byCurrency) -> {
            Long amount = byCurrency.get(currency);
            if (amount != null) {
                column.put(memberId, amount);
            }
        });
        return column;
    }

    /**
     * True when the member has a non-zero balance in any currency.
     */
    public boolean hasOutstandingBalance(String memberId) {
        Map<String, Long> byCurrency = balances.get(memberId);
        return byCurrency != null && byCurrency.values().stream().anyMatch(amount -> amount != 0L);
    }
}
