package com.flagship.split_ledger.balance.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.balance.GroupBalances;
import lombok.Value;

import java.util.Map;
import java.util.SortedMap;

/**
 * Net balances: member id -> currency -> signed minor units.
 * Positive means the group owes the member.
 */
@Value
public class BalanceResponse {

    @JsonProperty("group_id")
    String groupId;

    @JsonProperty("balances")
    Map<String, SortedMap<String, Long>> balances;

    public static BalanceResponse from(GroupBalances balances) {
        return new BalanceResponse(balances.getGroupId(), balances.getBalances());
    }
}
