package com.flagship.split_ledger.member;

import com.flagship.split_ledger.common.web.RequestHeaders;
import com.flagship.split_ledger.member.dto.JoinGroupRequest;
import com.flagship.split_ledger.member.dto.MemberResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Group membership endpoints. Removing yourself is leaving the group.
 */
@RestController
@RequestMapping("/api/groups/{groupId}/members")
@RequiredArgsConstructor
public class MemberController {

    private final GroupMemberService memberService;

    @PostMapping
    public ResponseEntity<MemberResponse> joinGroup(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @Valid @RequestBody JoinGroupRequest request) {
        GroupMember member = memberService.joinGroup(groupId, userId, request.getDisplayName(),
                request.getGroupDisplayName(), request.getThemeColor());
        return ResponseEntity.status(HttpStatus.CREATED).body(MemberResponse.from(member));
    }

    @GetMapping
    public List<MemberResponse> listMembers(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestParam(value = "include_departed", defaultValue = "false") boolean includeDeparted) {
        memberService.requireActiveMember(groupId, userId);
        return memberService.listMembers(groupId, includeDeparted).stream().map(MemberResponse::from).toList();
    }

    @DeleteMapping("/{memberId}")
    public MemberResponse removeMember(
            @PathVariable("groupId") String groupId,
            @PathVariable("memberId") String memberId,
            @RequestHeader(RequestHeaders.USER_ID) String userId) {
        return MemberResponse.from(memberService.removeMember(groupId, memberId, userId));
    }
}
