package com.flagship.split_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_ledger.settlement.Settlement;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SettlementResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("group_id")
    String groupId;

    @JsonProperty("payer_id")
    String payerId;

    @JsonProperty("payee_id")
    String payeeId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("date")
    Instant date;

    @JsonProperty("note")
    String note;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("version")
    long version;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static SettlementResponse from(Settlement settlement) {
        return SettlementResponse.builder()
                .id(settlement.getId())
                .groupId(settlement.getGroupId())
                .payerId(settlement.getPayerId())
                .payeeId(settlement.getPayeeId())
                .amount(settlement.getAmount())
                .currency(settlement.getCurrency())
                .date(settlement.getDate())
                .note(settlement.getNote())
                .createdBy(settlement.getCreatedBy())
                .version(settlement.getVersion())
                .createdAt(settlement.getCreatedAt())
                .updatedAt(settlement.getUpdatedAt())
                .build();
    }
}
