package com.flagship.split_ledger.settlement;

import com.flagship.split_ledger.common.exception.RecordNotFoundException;
import com.flagship.split_ledger.common.idempotency.IdempotentResult;
import com.flagship.split_ledger.common.web.RequestHeaders;
import com.flagship.split_ledger.member.GroupMemberService;
import com.flagship.split_ledger.settlement.dto.CreateSettlementRequest;
import com.flagship.split_ledger.settlement.dto.SettlementResponse;
import com.flagship.split_ledger.settlement.dto.UpdateSettlementRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for settlements. Same header contract as the expense endpoints.
 */
@RestController
@RequestMapping("/api/groups/{groupId}/settlements")
@RequiredArgsConstructor
@Slf4j
public class SettlementController {

    private final SettlementService settlementService;
    private final GroupMemberService memberService;

    @PostMapping
    public ResponseEntity<SettlementResponse> createSettlement(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @Valid @RequestBody CreateSettlementRequest request) {

        log.info("Received settlement request: groupId={}, payer={}, payee={}, amount={}, currency={}",
                groupId, request.getPayerId(), request.getPayeeId(), request.getAmount(), request.getCurrency());

        IdempotentResult<Settlement> result =
                settlementService.createSettlement(userId, request.toDraft(groupId), idempotencyKey);
        Settlement settlement = result.getRecord();
        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
                .eTag(RequestHeaders.etag(settlement.getVersion()))
                .body(SettlementResponse.from(settlement));
    }

    @GetMapping
    public List<SettlementResponse> listSettlements(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId) {
        memberService.requireActiveMember(groupId, userId);
        return settlementService.listGroupSettlements(groupId).stream().map(SettlementResponse::from).toList();
    }

    @GetMapping("/{settlementId}")
    public ResponseEntity<SettlementResponse> getSettlement(
            @PathVariable("groupId") String groupId,
            @PathVariable("settlementId") UUID settlementId,
            @RequestHeader(RequestHeaders.USER_ID) String userId) {
        memberService.requireActiveMember(groupId, userId);
        Settlement settlement = inGroup(groupId, settlementService.getSettlement(settlementId));
        return ResponseEntity.ok()
                .eTag(RequestHeaders.etag(settlement.getVersion()))
                .body(SettlementResponse.from(settlement));
    }

    @PatchMapping("/{settlementId}")
    public ResponseEntity<SettlementResponse> updateSettlement(
            @PathVariable("groupId") String groupId,
            @PathVariable("settlementId") UUID settlementId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.IF_MATCH, required = false) String ifMatch,
            @RequestBody UpdateSettlementRequest request) {
        inGroup(groupId, settlementService.getSettlement(settlementId));
        Settlement updated = settlementService.updateSettlement(
                settlementId, userId, request.toPatch(), RequestHeaders.expectedVersion(ifMatch));
        return ResponseEntity.ok()
                .eTag(RequestHeaders.etag(updated.getVersion()))
                .body(SettlementResponse.from(updated));
    }

    @DeleteMapping("/{settlementId}")
    public ResponseEntity<Void> deleteSettlement(
            @PathVariable("groupId") String groupId,
            @PathVariable("settlementId") UUID settlementId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.IF_MATCH, required = false) String ifMatch) {
        inGroup(groupId, settlementService.getSettlement(settlementId));
        settlementService.deleteSettlement(settlementId, userId, RequestHeaders.expectedVersion(ifMatch));
        return ResponseEntity.noContent().build();
    }

    private static Settlement inGroup(String groupId, Settlement settlement) {
        if (!settlement.getGroupId().equals(groupId)) {
            throw new RecordNotFoundException(SettlementStore.RECORD_TYPE, settlement.getId());
        }
        return settlement;
    }
}
