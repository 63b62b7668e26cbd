package com.flagship.split_ledger.group;

import com.flagship.split_ledger.common.web.RequestHeaders;
import com.flagship.split_ledger.group.dto.CreateGroupRequest;
import com.flagship.split_ledger.group.dto.GroupResponse;
import com.flagship.split_ledger.group.dto.UpdateGroupRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Group endpoints. The returned {@code id} is the {@code groupId} of every
 * other group-scoped path.
 */
@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
@Slf4j
public class GroupController {

    private final GroupService groupService;

    @PostMapping
    public ResponseEntity<GroupResponse> createGroup(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @Valid @RequestBody CreateGroupRequest request) {
        log.info("Received group request: name={}, createdBy={}", request.getName(), userId);
        Group group = groupService.createGroup(userId, request.getName(), request.getDescription(),
                request.getDisplayName());
        return ResponseEntity.status(HttpStatus.CREATED)
                .eTag(RequestHeaders.etag(group.getVersion()))
                .body(GroupResponse.from(group));
    }

    @GetMapping("/{groupId}")
    public ResponseEntity<GroupResponse> getGroup(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId) {
        Group group = groupService.getGroup(groupId, userId);
        return ResponseEntity.ok()
                .eTag(RequestHeaders.etag(group.getVersion()))
                .body(GroupResponse.from(group));
    }

    @PatchMapping("/{groupId}")
    public ResponseEntity<GroupResponse> updateGroup(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(value = RequestHeaders.IF_MATCH, required = false) String ifMatch,
            @RequestBody UpdateGroupRequest request) {
        Group updated = groupService.updateGroup(groupId, userId, request.toPatch(),
                RequestHeaders.expectedVersion(ifMatch));
        return ResponseEntity.ok()
                .eTag(RequestHeaders.etag(updated.getVersion()))
                .body(GroupResponse.from(updated));
    }
}
