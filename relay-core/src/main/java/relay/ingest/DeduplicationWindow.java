package relay.ingest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Remembers recently seen {@code (chatId, messageId)} pairs so redelivered source events are
 * forwarded at most once.
 *
 * <p>Entries expire after {@code window}; each chat keeps at most {@code maxPerChat} entries,
 * evicting the oldest first. An expired or evicted id counts as new.
 */
public final class DeduplicationWindow {
    private final Duration window;
    private final int maxPerChat;
    private final Clock clock;
    private final ConcurrentMap<String, LinkedHashMap<String, Instant>> chats = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> lastSweep;

    public DeduplicationWindow(Duration window, int maxPerChat, Clock clock) {
        this.window = Objects.requireNonNull(window, "window");
        if (window.isNegative()) {
            throw new IllegalArgumentException("window must be >= 0");
        }
        if (maxPerChat < 1) {
            throw new IllegalArgumentException("maxPerChat must be >= 1");
        }
        this.maxPerChat = maxPerChat;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastSweep = new AtomicReference<>(clock.instant());
    }

    public DeduplicationWindow(Duration window, int maxPerChat) {
        this(window, maxPerChat, Clock.systemUTC());
    }

    /**
     * Records a message id. At most once per window this also drops chats whose entries have
     * all expired.
     *
     * @return {@code true} if the id was not seen within the window
     */
    public boolean firstSeen(String chatId, String messageId) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        sweepIfDue(now, cutoff);
        boolean[] fresh = new boolean[1];
        chats.compute(chatId, (k, seen) -> {
            LinkedHashMap<String, Instant> entries = seen == null ? new LinkedHashMap<>() : seen;
            expire(entries, cutoff);
            if (!entries.containsKey(messageId)) {
                fresh[0] = true;
                entries.put(messageId, now);
                if (entries.size() > maxPerChat) {
                    Iterator<String> oldest = entries.keySet().iterator();
                    oldest.next();
                    oldest.remove();
                }
            }
            return entries;
        });
        return fresh[0];
    }

    /** Expires old entries in every chat and forgets chats left empty. */
    public void prune() {
        prune(clock.instant().minus(window));
    }

    public int size(String chatId) {
        int[] size = new int[1];
        chats.computeIfPresent(chatId, (k, seen) -> {
            size[0] = seen.size();
            return seen;
        });
        return size[0];
    }

    /** Number of chats with at least one remembered id. */
    public int chatCount() {
        return chats.size();
    }

    private void sweepIfDue(Instant now, Instant cutoff) {
        Instant last = lastSweep.get();
        if (now.isBefore(last.plus(window))) {
            return;
        }
        if (lastSweep.compareAndSet(last, now)) {
            prune(cutoff);
        }
    }

    private void prune(Instant cutoff) {
        for (String chatId : chats.keySet()) {
            chats.computeIfPresent(chatId, (k, seen) -> {
                expire(seen, cutoff);
                return seen.isEmpty() ? null : seen;
            });
        }
    }

    // entries are in insertion order, which is also timestamp order
    private static void expire(LinkedHashMap<String, Instant> seen, Instant cutoff) {
        Iterator<Map.Entry<String, Instant>> it = seen.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isAfter(cutoff)) {
                break;
            }
            it.remove();
        }
    }
}
