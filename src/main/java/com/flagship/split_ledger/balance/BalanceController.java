package com.flagship.split_ledger.balance;

import com.flagship.split_ledger.balance.dto.BalanceResponse;
import com.flagship.split_ledger.balance.dto.SimplifiedDebtResponse;
import com.flagship.split_ledger.common.web.RequestHeaders;
import com.flagship.split_ledger.member.GroupMemberService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derived views of a group's ledger. Read-only; nothing is stored.
 */
@RestController
@RequestMapping("/api/groups/{groupId}")
@RequiredArgsConstructor
public class BalanceController {

    private final BalanceQueryService balanceQueryService;
    private final GroupMemberService memberService;

    @GetMapping("/balances")
    public BalanceResponse getBalances(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId) {
        memberService.requireActiveMember(groupId, userId);
        return BalanceResponse.from(balanceQueryService.getGroupBalances(groupId));
    }

    @GetMapping(value = "/simplified-debts", params = "currency")
    public List<SimplifiedDebtResponse> getSimplifiedDebts(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestParam("currency") String currency) {
        memberService.requireActiveMember(groupId, userId);
        return balanceQueryService.getSimplifiedDebts(groupId, currency).stream()
                .map(SimplifiedDebtResponse::from)
                .toList();
    }

    /**
     * Every currency of the group, keyed by currency code.
     */
    @GetMapping("/simplified-debts")
    public Map<String, List<SimplifiedDebtResponse>> getAllSimplifiedDebts(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId) {
        memberService.requireActiveMember(groupId, userId);
        Map<String, List<SimplifiedDebtResponse>> response = new TreeMap<>();
        balanceQueryService.getAllSimplifiedDebts(groupId).forEach((currency, debts) ->
                response.put(currency, debts.stream().map(SimplifiedDebtResponse::from).toList()));
        return response;
    }
}
