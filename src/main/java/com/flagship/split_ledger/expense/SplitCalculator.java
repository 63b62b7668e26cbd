package com.flagship.split_ledger.expense;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Turns a validated draft into concrete split amounts in minor units.
 *
 * EQUAL and PERCENTAGE leave a remainder after integer division; it is handed
 * out one unit at a time to participants in ascending member-id order
 * (for PERCENTAGE, only those with a non-zero share), so
 * 100 split three ways is always 34/33/33 and the splits sum to the amount
 * exactly. Output order follows the draft's participant order.
 */
@Component
public class SplitCalculator {

    public static final int FULL_BASIS_POINTS = 10_000;

    public List<ExpenseSplit> computeSplits(ExpenseDraft draft) {
        return switch (draft.getSplitType()) {
            case EQUAL -> equal(draft.getAmount(), draft.getParticipants());
            case EXACT -> exact(draft);
            case PERCENTAGE -> percentage(draft);
        };
    }

    private List<ExpenseSplit> equal(long amount, List<String> participants) {
        int n = participants.size();
        long base = amount / n;
        Map<String, Long> shares = new HashMap<>();
        participants.forEach(memberId -> shares.put(memberId, base));
        distributeRemainder(shares, participants, amount % n);

        List<ExpenseSplit> splits = new ArrayList<>(n);
        for (String memberId : participants) {
            splits.add(ExpenseSplit.of(memberId, shares.get(memberId)));
        }
        return List.copyOf(splits);
    }

    private List<ExpenseSplit> exact(ExpenseDraft draft) {
        Map<String, Long> byMember = new HashMap<>();
        draft.getSplitInputs().forEach(input -> byMember.put(input.getMemberId(), input.getAmount()));

        List<ExpenseSplit> splits = new ArrayList<>();
        for (String memberId : draft.getParticipants()) {
            splits.add(ExpenseSplit.of(memberId, byMember.get(memberId)));
        }
        return List.copyOf(splits);
    }

    private List<ExpenseSplit> percentage(ExpenseDraft draft) {
        long amount = draft.getAmount();
        Map<String, Integer> basisPoints = new HashMap<>();
        draft.getSplitInputs().forEach(input -> basisPoints.put(input.getMemberId(), input.getBasisPoints()));

        Map<String, Long> shares = new HashMap<>();
        long allocated = 0L;
        for (String memberId : draft.getParticipants()) {
            long share = Math.multiplyExact(amount, (long) basisPoints.get(memberId)) / FULL_BASIS_POINTS;
            shares.put(memberId, share);
            allocated += share;
        }
        List<String> eligible = draft.getParticipants().stream()
                .filter(memberId -> basisPoints.get(memberId) > 0)
                .toList();
        distributeRemainder(shares, eligible, amount - allocated);

        List<ExpenseSplit> splits = new ArrayList<>();
        for (String memberId : draft.getParticipants()) {
            splits.add(new ExpenseSplit(memberId, shares.get(memberId), basisPoints.get(memberId)));
        }
        return List.copyOf(splits);
    }

    private static void distributeRemainder(Map<String, Long> shares, Collection<String> eligible, long remainder) {
        for (String memberId : new TreeSet<>(eligible)) {
            if (remainder <= 0) {
                break;
            }
            shares.merge(memberId, 1L, Long::sum);
            remainder--;
        }
    }
}
