package com.flagship.split_ledger.settlement;

import com.flagship.split_ledger.common.exception.ConflictException;
import com.flagship.split_ledger.common.exception.ForbiddenOperationException;
import com.flagship.split_ledger.common.exception.LedgerValidationException;
import com.flagship.split_ledger.common.exception.RecordNotFoundException;
import com.flagship.split_ledger.common.idempotency.IdempotentResult;
import com.flagship.split_ledger.group.GroupService;
import com.flagship.split_ledger.member.GroupMemberService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Settlement lifecycle: creation defaults, idempotent replay, the creator-only
 * rule for changes and soft deletion.
 */
@SpringBootTest
@Testcontainers
@ActiveProfiles("test")
class SettlementServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("split_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private SettlementService settlementService;

    @Autowired
    private GroupService groupService;

    @Autowired
    private GroupMemberService memberService;

    private String groupId;

    @BeforeEach
    void setUp() {
        groupId = groupService.createGroup("alice", "Trip", null, null).getGroupId();
        for (String user : List.of("bob", "carol")) {
            memberService.joinGroup(groupId, user, user, null, null);
        }
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private SettlementDraft.SettlementDraftBuilder bobPaysAlice() {
        return SettlementDraft.builder()
                .groupId(groupId)
                .payerId("bob")
                .payeeId("alice")
                .amount(3333)
                .currency("usd");
    }

    @Test
    @DisplayName("Create normalizes currency and defaults the date")
    void createDefaults() {
        printTestHeader("Create settlement");

        Settlement created = settlementService.createSettlement("bob", bobPaysAlice().note("  ").build(), null)
                .getRecord();
        Settlement stored = settlementService.getSettlement(created.getId());

        assertEquals("USD", stored.getCurrency());
        assertNotNull(stored.getDate());
        assertNull(stored.getNote());
        assertEquals("bob", stored.getCreatedBy());
        assertEquals(1L, stored.getVersion());
        printSuccess("Settlement stored with defaults applied");
    }

    @Test
    @DisplayName("Same idempotency key replays the first settlement")
    void idempotentReplay() {
        String key = "settle-" + UUID.randomUUID();

        IdempotentResult<Settlement> first = settlementService.createSettlement("bob", bobPaysAlice().build(), key);
        IdempotentResult<Settlement> second = settlementService.createSettlement("bob", bobPaysAlice().build(), key);

        assertTrue(second.isReplayed());
        assertEquals(first.getRecord().getId(), second.getRecord().getId());
        assertEquals(1, settlementService.listGroupSettlements(groupId).size());
    }

    @Test
    @DisplayName("Idempotency key reused in another group is rejected")
    void keyReusedAcrossGroups() {
        String key = "settle-" + UUID.randomUUID();
        settlementService.createSettlement("bob", bobPaysAlice().build(), key);

        String otherGroup = groupService.createGroup("bob", "Other trip", null, null).getGroupId();
        memberService.joinGroup(otherGroup, "alice", "alice", null, null);

        LedgerValidationException e = assertThrows(LedgerValidationException.class,
                () -> settlementService.createSettlement("bob", bobPaysAlice().groupId(otherGroup).build(), key));
        assertEquals("IDEMPOTENCY_KEY_REUSED", e.getCode());
    }

    @Test
    @DisplayName("Only the creator may update; payer and payee stay fixed")
    void creatorOnlyUpdate() {
        Settlement created = settlementService.createSettlement("bob", bobPaysAlice().build(), null).getRecord();

        ForbiddenOperationException e = assertThrows(ForbiddenOperationException.class,
                () -> settlementService.updateSettlement(created.getId(), "alice",
                        SettlementPatch.builder().amount(1L).build(), null));
        assertEquals("NOT_SETTLEMENT_CREATOR", e.getCode());

        Settlement updated = settlementService.updateSettlement(created.getId(), "bob",
                SettlementPatch.builder().amount(3000L).note("cash").build(), 1L);

        assertEquals(2L, updated.getVersion());
        assertEquals(3000L, updated.getAmount());
        assertEquals("cash", updated.getNote());
        assertEquals("bob", updated.getPayerId());
        assertEquals("alice", updated.getPayeeId());
    }

    @Test
    @DisplayName("Blank note in a patch clears the note")
    void blankNoteClears() {
        Settlement created = settlementService.createSettlement("bob", bobPaysAlice().note("venmo").build(), null)
                .getRecord();

        Settlement updated = settlementService.updateSettlement(created.getId(), "bob",
                SettlementPatch.builder().note("").build(), null);

        assertNull(updated.getNote());
    }

    @Test
    @DisplayName("Stale version is a conflict")
    void staleVersion() {
        Settlement created = settlementService.createSettlement("bob", bobPaysAlice().build(), null).getRecord();
        settlementService.updateSettlement(created.getId(), "bob", SettlementPatch.builder().amount(10L).build(), 1L);

        assertThrows(ConflictException.class, () -> settlementService.updateSettlement(created.getId(), "bob",
                SettlementPatch.builder().amount(20L).build(), 1L));
        assertEquals(10L, settlementService.getSettlement(created.getId()).getAmount());
    }

    @Test
    @DisplayName("Only the creator may delete; deleted settlements are not found")
    void creatorOnlyDelete() {
        Settlement created = settlementService.createSettlement("bob", bobPaysAlice().build(), null).getRecord();

        assertThrows(ForbiddenOperationException.class,
                () -> settlementService.deleteSettlement(created.getId(), "carol", null));

        Settlement deleted = settlementService.deleteSettlement(created.getId(), "bob", null);

        assertTrue(deleted.isDeleted());
        assertThrows(RecordNotFoundException.class, () -> settlementService.getSettlement(created.getId()));
        assertTrue(settlementService.listGroupSettlements(groupId).isEmpty());
    }
}
