package com.flagship.split_ledger.health;

import com.flagship.split_ledger.notification.ChangeNotificationTracker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthControllerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    @DisplayName("Ready when the database answers and the tracker runs")
    void ready() throws Exception {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(true);
        ChangeNotificationTracker tracker = mock(ChangeNotificationTracker.class);
        when(tracker.isRunning()).thenReturn(true);
        when(tracker.pendingCount()).thenReturn(4);

        ResponseEntity<Map<String, Object>> response = new HealthController(dataSource, tracker, clock).health();

        assertEquals(200, response.getStatusCode().value());
        assertEquals("UP", response.getBody().get("status"));
        assertEquals(4, response.getBody().get("pending_notifications"));
    }

    @Test
    @DisplayName("Unreachable database makes the service unavailable")
    void databaseDown() throws Exception {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));
        ChangeNotificationTracker tracker = mock(ChangeNotificationTracker.class);
        when(tracker.isRunning()).thenReturn(true);

        ResponseEntity<Map<String, Object>> response = new HealthController(dataSource, tracker, clock).health();

        assertEquals(503, response.getStatusCode().value());
        assertEquals("DOWN", response.getBody().get("database"));
    }

    @Test
    @DisplayName("Stopped change tracker makes the service unavailable")
    void trackerStopped() throws Exception {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(true);
        ChangeNotificationTracker tracker = mock(ChangeNotificationTracker.class);

        ResponseEntity<Map<String, Object>> response = new HealthController(dataSource, tracker, clock).health();

        assertEquals(503, response.getStatusCode().value());
        assertEquals("DOWN", response.getBody().get("change_tracker"));
    }
}
