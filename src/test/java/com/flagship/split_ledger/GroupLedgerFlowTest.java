package com.flagship.split_ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.split_ledger.notification.ChangeNotificationTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * One group through the HTTP API:
 * alice creates it and the others join, an expense is recorded (and replayed), balances and suggested
 * payments are read, a settlement clears one debt, and members leave only when
 * their balance is zero.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
@ActiveProfiles("test")
class GroupLedgerFlowTest {

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
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ChangeNotificationTracker tracker;

    private String groupId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() throws Exception {
        MvcResult group = mockMvc.perform(post("/api/groups")
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("name", "Trip", "display_name", "alice"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.created_by").value("alice"))
                .andReturn();
        groupId = body(group).get("id").asText();
        for (String user : List.of("bob", "carol")) {
            mockMvc.perform(post("/api/groups/{groupId}/members", groupId)
                            .header("X-User-Id", user)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(Map.of("display_name", user))))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.active").value(true));
        }
    }

    private String dinnerJson() throws Exception {
        return objectMapper.writeValueAsString(Map.of(
                "description", "Dinner",
                "category", "food",
                "date", Instant.now().minus(1, ChronoUnit.HOURS).toString(),
                "payer_id", "alice",
                "amount", 10000,
                "currency", "USD",
                "split_type", "equal",
                "participants", List.of("alice", "bob", "carol")));
    }

    private JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("Expense, balances, settlement and leaving the group")
    void fullGroupFlow() throws Exception {
        printTestHeader("Full group flow");
        String key = "dinner-" + UUID.randomUUID();
        printInput("Expense", dinnerJson());

        MvcResult created = mockMvc.perform(post("/api/groups/{groupId}/expenses", groupId)
                        .header("X-User-Id", "alice")
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(dinnerJson()))
                .andExpect(status().isCreated())
                .andExpect(header().string("ETag", "\"1\""))
                .andExpect(jsonPath("$.splits.length()").value(3))
                .andReturn();
        String expenseId = body(created).get("id").asText();

        mockMvc.perform(post("/api/groups/{groupId}/expenses", groupId)
                        .header("X-User-Id", "alice")
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(dinnerJson()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(expenseId));

        mockMvc.perform(get("/api/groups/{groupId}/balances", groupId).header("X-User-Id", "bob"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balances.alice.USD").value(6666))
                .andExpect(jsonPath("$.balances.bob.USD").value(-3333))
                .andExpect(jsonPath("$.balances.carol.USD").value(-3333));

        MvcResult debts = mockMvc.perform(get("/api/groups/{groupId}/simplified-debts", groupId)
                        .header("X-User-Id", "carol")
                        .param("currency", "usd"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andReturn();
        printOutput("Simplified debts", body(debts));
        for (JsonNode debt : body(debts)) {
            assertEquals("alice", debt.get("to").asText());
            assertEquals(3333L, debt.get("amount").asLong());
        }

        MvcResult settlement = mockMvc.perform(post("/api/groups/{groupId}/settlements", groupId)
                        .header("X-User-Id", "bob")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "payer_id", "bob", "payee_id", "alice", "amount", 3333, "currency", "USD"))))
                .andExpect(status().isCreated())
                .andReturn();
        String settlementId = body(settlement).get("id").asText();

        mockMvc.perform(patch("/api/groups/{groupId}/settlements/{id}", groupId, settlementId)
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 1}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_SETTLEMENT_CREATOR"));

        mockMvc.perform(get("/api/groups/{groupId}/balances", groupId).header("X-User-Id", "alice"))
                .andExpect(jsonPath("$.balances.alice.USD").value(3333))
                .andExpect(jsonPath("$.balances.carol.USD").value(-3333));

        mockMvc.perform(delete("/api/groups/{groupId}/members/{memberId}", groupId, "carol")
                        .header("X-User-Id", "carol"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("OUTSTANDING_BALANCE"));

        mockMvc.perform(delete("/api/groups/{groupId}/members/{memberId}", groupId, "bob")
                        .header("X-User-Id", "bob"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        printSuccess("Balances, suggested payments and membership rules hold end to end");
    }

    @Test
    @DisplayName("If-Match with a stale version is rejected with 409")
    void staleIfMatch() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/groups/{groupId}/expenses", groupId)
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(dinnerJson()))
                .andExpect(status().isCreated())
                .andReturn();
        String expenseId = body(created).get("id").asText();

        mockMvc.perform(patch("/api/groups/{groupId}/expenses/{id}", groupId, expenseId)
                        .header("X-User-Id", "bob")
                        .header("If-Match", "\"1\"")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"Brunch\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("ETag", "\"2\""));

        mockMvc.perform(patch("/api/groups/{groupId}/expenses/{id}", groupId, expenseId)
                        .header("X-User-Id", "carol")
                        .header("If-Match", "W/\"1\"")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"Lunch\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("VERSION_CONFLICT"));

        mockMvc.perform(delete("/api/groups/{groupId}/expenses/{id}", groupId, expenseId)
                        .header("X-User-Id", "carol")
                        .header("If-Match", "2"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/groups/{groupId}/expenses/{id}", groupId, expenseId)
                        .header("X-User-Id", "carol"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Request validation and missing headers map to 400")
    void badRequests() throws Exception {
        mockMvc.perform(post("/api/groups/{groupId}/expenses", groupId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(dinnerJson()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_HEADER"));

        mockMvc.perform(post("/api/groups/{groupId}/expenses", groupId)
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\": \"\", \"amount\": -1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        mockMvc.perform(get("/api/groups/{groupId}/balances", groupId).header("X-User-Id", "mallory"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("NOT_A_MEMBER"));
    }

    @Test
    @DisplayName("Every member's change version moves after an expense is recorded")
    void changeTrackingAfterExpense() throws Exception {
        tracker.drainAll();
        long before = body(mockMvc.perform(get("/api/groups/{groupId}/changes", groupId)
                        .header("X-User-Id", "carol"))
                .andExpect(status().isOk())
                .andReturn()).get("change_version").asLong();

        mockMvc.perform(post("/api/groups/{groupId}/expenses", groupId)
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(dinnerJson()))
                .andExpect(status().isCreated());
        tracker.drainAll();

        for (String user : List.of("alice", "bob", "carol")) {
            JsonNode changes = body(mockMvc.perform(get("/api/groups/{groupId}/changes", groupId)
                            .header("X-User-Id", user))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.user_id").value(user))
                    .andReturn());
            printOutput("Changes for " + user, changes);
            assertTrue(changes.get("change_version").asLong() > ("carol".equals(user) ? before : 0));
            assertFalse(changes.get("recent_changes").isEmpty());
        }
    }

    @Test
    @DisplayName("Group details are owner-edited and comment threads page newest first")
    void groupDetailsAndComments() throws Exception {
        printTestHeader("Group details and comments");
        mockMvc.perform(get("/api/groups/{groupId}", groupId).header("X-User-Id", "bob"))
                .andExpect(status().isOk())
                .andExpect(header().string("ETag", "\"1\""))
                .andExpect(jsonPath("$.name").value("Trip"));
        mockMvc.perform(get("/api/groups/{groupId}", groupId).header("X-User-Id", "mallory"))
                .andExpect(status().isNotFound());

        mockMvc.perform(patch("/api/groups/{groupId}", groupId)
                        .header("X-User-Id", "bob")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Bob's trip\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_GROUP_OWNER"));
        mockMvc.perform(patch("/api/groups/{groupId}", groupId)
                        .header("X-User-Id", "alice")
                        .header("If-Match", "\"1\"")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Lisbon\", \"description\": \"May long weekend\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("ETag", "\"2\""))
                .andExpect(jsonPath("$.description").value("May long weekend"));

        String expenseId = body(mockMvc.perform(post("/api/groups/{groupId}/expenses", groupId)
                        .header("X-User-Id", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(dinnerJson()))
                .andExpect(status().isCreated())
                .andReturn()).get("id").asText();

        for (String text : List.of("Who booked the hotel?", "I did", "Thanks!")) {
            mockMvc.perform(post("/api/groups/{groupId}/comments", groupId)
                            .header("X-User-Id", "carol")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(Map.of("text", text))))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.author_name").value("carol"));
        }
        mockMvc.perform(post("/api/groups/{groupId}/expenses/{id}/comments", groupId, expenseId)
                        .header("X-User-Id", "bob")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"Tip included\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.expense_id").value(expenseId));

        JsonNode first = body(mockMvc.perform(get("/api/groups/{groupId}/comments", groupId)
                        .header("X-User-Id", "alice")
                        .param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.comments.length()").value(2))
                .andExpect(jsonPath("$.comments[0].text").value("Thanks!"))
                .andExpect(jsonPath("$.has_more").value(true))
                .andReturn());
        printOutput("First page", first);

        mockMvc.perform(get("/api/groups/{groupId}/comments", groupId)
                        .header("X-User-Id", "alice")
                        .param("limit", "2")
                        .param("cursor", first.get("next_cursor").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.comments.length()").value(1))
                .andExpect(jsonPath("$.comments[0].text").value("Who booked the hotel?"))
                .andExpect(jsonPath("$.has_more").value(false));

        mockMvc.perform(get("/api/groups/{groupId}/expenses/{id}/comments", groupId, expenseId)
                        .header("X-User-Id", "carol"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.comments.length()").value(1))
                .andExpect(jsonPath("$.comments[0].author_id").value("bob"));

        mockMvc.perform(get("/api/groups/{groupId}/comments", groupId).header("X-User-Id", "mallory"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("NOT_A_MEMBER"));

        printSuccess("Owner-only edits, paged threads and member-only access hold over HTTP");
    }
}
