package com.flagship.split_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed settings for the ledger core, bound from the {@code ledger.*} namespace.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    private Mutation mutation = new Mutation();
    private Notification notification = new Notification();
    private Topic topic = new Topic();

    @Getter
    @Setter
    public static class Mutation {
        /** Attempts per update/delete when no explicit version was supplied. */
        private int maxAttempts = 3;
        /** Linear backoff step between conflict retries. */
        private Duration backoff = Duration.ofMillis(50);
        /** Timeout applied to each store transaction. */
        private Duration transactionTimeout = Duration.ofSeconds(5);
        /** Upper bound on the wall time of one mutation including retries. */
        private Duration maxTotalDuration = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Notification {
        private Duration debounceWindow = Duration.ofMillis(500);
        private int recentChangesLimit = 10;
        private int schedulerThreads = 2;
        private int maxFlushAttempts = 3;
        /** How long an SSE change-version stream stays open before the client must reconnect. */
        private Duration streamTimeout = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Topic {
        private String changeNotifications = "ledger.change-notifications";
    }
}
