package app.webradio.engagement.support;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity FIFO. Appending to a full history evicts the oldest entry first.
 * <p>
 * Not thread-safe: callers guard it with the lock of the aggregate that owns it.
 */
public final class BoundedHistory<T> {

    private final int capacity;
    private final ArrayDeque<T> entries;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public void append(T entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry is required");
        }
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    public List<T> snapshot() {
        return List.copyOf(entries);
    }

    /**
     * Newest {@code limit} entries, oldest first.
     */
    public List<T> latest(int limit) {
        if (limit <= 0 || entries.isEmpty()) {
            return List.of();
        }
        int skip = Math.max(0, entries.size() - limit);
        List<T> out = new ArrayList<>(Math.min(limit, entries.size()));
        int index = 0;
        for (T entry : entries) {
            if (index++ >= skip) {
                out.add(entry);
            }
        }
        return List.copyOf(out);
    }
}
