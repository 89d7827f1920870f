package lab.relay.event;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Bounded, time-evicted set of event ids already taken into processing.
 * {@link #markSeen} is an atomic check-and-insert, so two concurrent deliveries of one event cannot both win.
 */
@Slf4j
public class EventDedupSet {

    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;
    private final Map<String, Instant> seenAt = new ConcurrentHashMap<>();
    private final Queue<String> insertionOrder = new ConcurrentLinkedQueue<>();

    public EventDedupSet(Duration ttl, int maxEntries, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    // Returns true only for the first caller presenting this event id.
    public boolean markSeen(String eventId) {
        Instant now = clock.instant();
        if (seenAt.putIfAbsent(eventId, now) != null) {
            return false;
        }
        insertionOrder.add(eventId);
        trimToCapacity();
        return true;
    }

    public boolean contains(String eventId) {
        return seenAt.containsKey(eventId);
    }

    public int size() {
        return seenAt.size();
    }

    public int evictExpired(Instant now) {
        int evicted = 0;
        String head;
        while ((head = insertionOrder.peek()) != null) {
            Instant at = seenAt.get(head);
            if (at != null && Duration.between(at, now).compareTo(ttl) < 0) {
                break;
            }
            if (insertionOrder.remove(head)) {
                seenAt.remove(head);
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("event=dedup.evicted count={}", evicted);
        }
        return evicted;
    }

    private void trimToCapacity() {
        while (seenAt.size() > maxEntries) {
            String oldest = insertionOrder.poll();
            if (oldest == null) {
                return;
            }
            seenAt.remove(oldest);
            log.debug("event=dedup.capacity_evicted eventId={}", oldest);
        }
    }
}
