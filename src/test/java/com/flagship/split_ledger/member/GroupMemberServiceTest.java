package com.flagship.split_ledger.member;

import com.flagship.split_ledger.balance.BalanceQueryService;
import com.flagship.split_ledger.common.exception.LedgerValidationException;
import com.flagship.split_ledger.common.exception.RecordNotFoundException;
import com.flagship.split_ledger.expense.Expense;
import com.flagship.split_ledger.expense.ExpenseDraft;
import com.flagship.split_ledger.expense.ExpensePatch;
import com.flagship.split_ledger.expense.ExpenseService;
import com.flagship.split_ledger.expense.ExpenseStore;
import com.flagship.split_ledger.expense.SplitType;
import com.flagship.split_ledger.group.GroupService;
import com.flagship.split_ledger.notification.ChangeCategory;
import com.flagship.split_ledger.notification.ChangeKey;
import com.flagship.split_ledger.notification.ChangeNotificationTracker;
import com.flagship.split_ledger.notification.ChangeTrackingPersistenceService;
import com.flagship.split_ledger.settlement.SettlementDraft;
import com.flagship.split_ledger.settlement.SettlementService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.flagship.split_ledger.support.LedgerFixtures.expense;
import static com.flagship.split_ledger.support.LedgerFixtures.split;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers
@ActiveProfiles("test")
class GroupMemberServiceTest {

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
    private GroupService groupService;

    @Autowired
    private GroupMemberService memberService;

    @Autowired
    private ExpenseService expenseService;

    @Autowired
    private SettlementService settlementService;

    @Autowired
    private ExpenseStore expenseStore;

    @Autowired
    private GroupMemberRepository memberRepository;

    @Autowired
    private BalanceQueryService balanceQueryService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private ChangeNotificationTracker tracker;

    @Autowired
    private ChangeTrackingPersistenceService changeTracking;

    private String groupId;

    @BeforeEach
    void setUp() {
        groupId = groupService.createGroup("alice", "Flat", null, "Alice").getGroupId();
    }

    @Test
    @DisplayName("Only existing groups can be joined")
    void unknownGroup() {
        assertThrows(RecordNotFoundException.class,
                () -> memberService.joinGroup(UUID.randomUUID().toString(), "bob", "Bob", null, null));
        assertThrows(RecordNotFoundException.class,
                () -> memberService.joinGroup("not-a-group", "bob", "Bob", null, null));
    }

    @Test
    @DisplayName("Joining twice is rejected while the membership is active")
    void alreadyMember() {
        LedgerValidationException e = assertThrows(LedgerValidationException.class,
                () -> memberService.joinGroup(groupId, "alice", "Alice", null, null));
        assertEquals("ALREADY_MEMBER", e.getCode());
    }

    @Test
    @DisplayName("Departed member keeps their row and can rejoin with new details")
    void leaveAndRejoin() {
        memberService.joinGroup(groupId, "bob", "Bob", null, null);

        GroupMember departed = memberService.removeMember(groupId, "bob", "alice");
        assertFalse(departed.isActive());
        assertEquals(List.of("alice"), memberService.listActiveMemberIds(groupId));
        assertEquals(2, memberService.listMembers(groupId, true).size());

        GroupMember rejoined = memberService.joinGroup(groupId, "bob", "Bobby", "B", null);
        assertTrue(rejoined.isActive());
        assertEquals("B", rejoined.effectiveName());
        assertEquals(List.of("alice", "bob"), memberService.listActiveMemberIds(groupId));
    }

    @Test
    @DisplayName("Removing someone requires an active acting member and an active target")
    void removalChecks() {

        LedgerValidationException notMember = assertThrows(LedgerValidationException.class,
                () -> memberService.removeMember(groupId, "alice", "mallory"));
        assertEquals("NOT_A_MEMBER", notMember.getCode());
        assertThrows(RecordNotFoundException.class, () -> memberService.removeMember(groupId, "ghost", "alice"));
    }

    @Test
    @DisplayName("Member with an open balance cannot leave")
    void outstandingBalance() {
        memberService.joinGroup(groupId, "bob", "Bob", null, null);
        expenseService.createExpense("alice", taxi("alice", 2000), null);

        LedgerValidationException e = assertThrows(LedgerValidationException.class,
                () -> memberService.removeMember(groupId, "bob", "bob"));
        assertEquals("OUTSTANDING_BALANCE", e.getCode());
        assertTrue(memberService.listActiveMemberIds(groupId).contains("bob"));
    }

    @Test
    @DisplayName("Departing member is still told about their own removal")
    void removedMemberNotified() {
        memberService.joinGroup(groupId, "bob", "Bob", null, null);
        tracker.drainAll();
        long before = changeTracking.findOrEmpty(ChangeKey.of("bob", groupId))
                .counter(ChangeCategory.GROUP_DETAILS).getCount();

        memberService.removeMember(groupId, "bob", "alice");
        tracker.drainAll();

        assertEquals(before + 1, changeTracking.findOrEmpty(ChangeKey.of("bob", groupId))
                .counter(ChangeCategory.GROUP_DETAILS).getCount());
    }

    @Test
    @DisplayName("Removal waits for an in-flight expense naming the member, then sees its balance")
    void removalWaitsForInFlightExpense() throws Exception {
        memberService.joinGroup(groupId, "bob", "Bob", null, null);
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            Future<?> writer = pool.submit(() -> tx.executeWithoutResult(status -> {
                memberService.lockActiveParticipants(groupId, List.of("alice", "bob"));
                locked.countDown();
                awaitRelease(release);
                expenseStore.insert(expense(groupId, "alice", 2000, "EUR",
                        split("alice", 1000), split("bob", 1000)));
            }));
            assertTrue(locked.await(10, TimeUnit.SECONDS));

            Future<GroupMember> removal = pool.submit(() -> memberService.removeMember(groupId, "bob", "alice"));
            Thread.sleep(300);
            assertFalse(removal.isDone(), "removal must block on the membership row");

            release.countDown();
            writer.get(10, TimeUnit.SECONDS);

            ExecutionException e = assertThrows(ExecutionException.class, () -> removal.get(10, TimeUnit.SECONDS));
            LedgerValidationException cause = assertInstanceOf(LedgerValidationException.class, e.getCause());
            assertEquals("OUTSTANDING_BALANCE", cause.getCode());
            assertTrue(memberService.listActiveMemberIds(groupId).contains("bob"));
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Expense naming a member whose removal commits first is rejected")
    void expenseLosesToCommittedRemoval() throws Exception {
        memberService.joinGroup(groupId, "bob", "Bob", null, null);
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            Future<?> remover = pool.submit(() -> tx.executeWithoutResult(status -> {
                GroupMemberEntity bob = memberRepository.lockMembership(groupId, "bob").orElseThrow();
                locked.countDown();
                awaitRelease(release);
                bob.leave(Instant.now());
                memberRepository.save(bob);
            }));
            assertTrue(locked.await(10, TimeUnit.SECONDS));

            // bob still looks active to the pre-check, so the write reaches the lock
            Future<?> create = pool.submit(() -> expenseService.createExpense("alice", taxi("alice", 2000), null));
            Thread.sleep(300);
            assertFalse(create.isDone(), "expense insert must block on bob's membership row");

            release.countDown();
            remover.get(10, TimeUnit.SECONDS);

            ExecutionException e = assertThrows(ExecutionException.class, () -> create.get(10, TimeUnit.SECONDS));
            LedgerValidationException cause = assertInstanceOf(LedgerValidationException.class, e.getCause());
            assertEquals("PARTICIPANT_DEPARTED", cause.getCode());
            assertTrue(expenseService.listGroupExpenses(groupId).isEmpty());
            assertFalse(balanceQueryService.getGroupBalances(groupId).hasOutstandingBalance("bob"));
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Records involving a departed member can no longer be changed")
    void departedMemberFreezesRecords() {
        memberService.joinGroup(groupId, "bob", "Bob", null, null);
        Expense lunch = expenseService.createExpense("bob", taxi("bob", 1000), null).getRecord();
        settlementService.createSettlement("alice", SettlementDraft.builder()
                .groupId(groupId)
                .payerId("alice")
                .payeeId("bob")
                .amount(500)
                .currency("EUR")
                .build(), null);
        memberService.removeMember(groupId, "bob", "bob");

        LedgerValidationException update = assertThrows(LedgerValidationException.class,
                () -> expenseService.updateExpense(lunch.getId(), "alice", ExpensePatch.builder()
                        .payerId("alice")
                        .participants(List.of("alice"))
                        .build(), null));
        assertEquals("PARTICIPANT_DEPARTED", update.getCode());

        LedgerValidationException delete = assertThrows(LedgerValidationException.class,
                () -> expenseService.deleteExpense(lunch.getId(), "alice", null));
        assertEquals("PARTICIPANT_DEPARTED", delete.getCode());
        assertEquals(1L, expenseService.getExpense(lunch.getId()).getVersion());
    }

    private ExpenseDraft taxi(String payerId, long amount) {
        return ExpenseDraft.builder()
                .groupId(groupId)
                .description("Taxi")
                .category("transport")
                .date(Instant.now().minus(1, ChronoUnit.HOURS))
                .payerId(payerId)
                .amount(amount)
                .currency("EUR")
                .splitType(SplitType.EQUAL)
                .participants(List.of("alice", "bob"))
                .build();
    }

    private static void awaitRelease(CountDownLatch release) {
        try {
            if (!release.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Test never released the held lock");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
