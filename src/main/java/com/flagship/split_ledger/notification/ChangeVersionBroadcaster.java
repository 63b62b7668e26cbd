package com.flagship.split_ledger.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process fan-out of committed change-tracking records to live subscribers
 * (the SSE endpoint). Out-of-process consumers use the Kafka topic instead.
 *
 * Each subscription only ever sees increasing change versions: a record that
 * is not newer than the last one delivered is skipped. This makes the
 * "emit current, then follow updates" handshake safe against the race with
 * a concurrent publish.
 */
@Component
@Slf4j
public class ChangeVersionBroadcaster {

    private final ConcurrentMap<ChangeKey, Set<Subscription>> subscribers = new ConcurrentHashMap<>();

    /**
     * Registers the listener and immediately delivers {@code current}.
     */
    public Subscription subscribe(ChangeKey key, ChangeTrackingRecord current, Consumer<ChangeTrackingRecord> listener) {
        Subscription subscription = new Subscription(key, listener);
        subscribers.computeIfAbsent(key, k -> new CopyOnWriteArraySet<>()).add(subscription);
        subscription.deliver(current);
        log.debug("Subscribed to change versions of {} ({} listener(s))", key, subscriberCount(key));
        return subscription;
    }

    public void publish(ChangeTrackingRecord record) {
        Set<Subscription> listeners = subscribers.get(record.key());
        if (listeners == null) {
            return;
        }
        for (Subscription subscription : listeners) {
            subscription.deliver(record);
        }
    }

    public void publishAll(List<ChangeTrackingRecord> records) {
        records.forEach(this::publish);
    }

    public int subscriberCount(ChangeKey key) {
        Set<Subscription> listeners = subscribers.get(key);
        return listeners == null ? 0 : listeners.size();
    }

    private void unsubscribe(Subscription subscription) {
        subscribers.computeIfPresent(subscription.key, (k, set) -> {
            set.remove(subscription);
            return set.isEmpty() ? null : set;
        });
    }

    public final class Subscription implements AutoCloseable {

        private final ChangeKey key;
        private final Consumer<ChangeTrackingRecord> listener;
        private final AtomicLong lastDelivered = new AtomicLong(-1);
        private volatile boolean closed;

        private Subscription(ChangeKey key, Consumer<ChangeTrackingRecord> listener) {
            this.key = key;
            this.listener = listener;
        }

        private void deliver(ChangeTrackingRecord record) {
            if (closed) {
                return;
            }
            long version = record.getChangeVersion();
            long previous;
            do {
                previous = lastDelivered.get();
                if (version <= previous) {
                    return;
                }
            } while (!lastDelivered.compareAndSet(previous, version));

            try {
                listener.accept(record);
            } catch (RuntimeException e) {
                log.warn("Listener for {} failed, closing subscription: {}", key, e.getMessage());
                close();
            }
        }

        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                unsubscribe(this);
            }
        }
    }
}
