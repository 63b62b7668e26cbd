package com.flagship.split_ledger.notification;

import com.flagship.split_ledger.common.web.RequestHeaders;
import com.flagship.split_ledger.config.LedgerProperties;
import com.flagship.split_ledger.member.GroupMemberService;
import com.flagship.split_ledger.notification.dto.ChangeTrackingResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Change-tracking record of the calling user in a group, as a one-off read
 * or as a server-sent event stream.
 *
 * The stream emits the current record on connect, then one {@code change-version}
 * event per persisted batch, always with an increasing version.
 */
@RestController
@RequestMapping("/api/groups/{groupId}/changes")
@RequiredArgsConstructor
@Slf4j
public class ChangeNotificationController {

    static final String EVENT_NAME = "change-version";

    private final ChangeTrackingPersistenceService persistenceService;
    private final ChangeVersionBroadcaster broadcaster;
    private final GroupMemberService memberService;
    private final LedgerProperties properties;

    @GetMapping
    public ChangeTrackingResponse getChangeTrackingRecord(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId) {
        return ChangeTrackingResponse.from(persistenceService.findOrEmpty(ChangeKey.of(userId, groupId)));
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribeChangeVersion(
            @PathVariable("groupId") String groupId,
            @RequestHeader(RequestHeaders.USER_ID) String userId) {
        memberService.requireActiveMember(groupId, userId);
        ChangeKey key = ChangeKey.of(userId, groupId);
        SseEmitter emitter = new SseEmitter(properties.getNotification().getStreamTimeout().toMillis());

        ChangeVersionBroadcaster.Subscription subscription = broadcaster.subscribe(
                key, persistenceService.findOrEmpty(key), record -> send(emitter, record));

        emitter.onCompletion(subscription::close);
        emitter.onTimeout(() -> {
            subscription.close();
            emitter.complete();
        });
        emitter.onError(error -> subscription.close());
        log.debug("Change-version stream opened for {}", key);
        return emitter;
    }

    private static void send(SseEmitter emitter, ChangeTrackingRecord record) {
        try {
            emitter.send(SseEmitter.event()
                    .name(EVENT_NAME)
                    .id(Long.toString(record.getChangeVersion()))
                    .data(ChangeTrackingResponse.from(record), MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            throw new UncheckedIOException("Client disconnected from change stream", e);
        }
    }
}
