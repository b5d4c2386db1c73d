package io.fabricla.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Accumulates items for one channel under a record-count and byte-size ceiling. Not thread-safe on its own;
 * callers guard each buffer with its own lock.
 *
 * <p>Size accounting models a JSON array body: two bytes of brackets plus one separator per item after the first.
 */
public final class BatchBuffer<T> {
    private final int maxRecords;
    private final long maxBytes;
    private List<T> items = new ArrayList<>();
    private long bytes = 2;

    public BatchBuffer(int maxRecords, long maxBytes) {
        if (maxRecords < 1) throw new IllegalArgumentException("maxRecords must be >= 1");
        if (maxBytes < 3) throw new IllegalArgumentException("maxBytes must be >= 3");
        this.maxRecords = maxRecords;
        this.maxBytes = maxBytes;
    }

    /**
     * Adds an item and returns the batches that became ready. If the item would push the buffer past the byte
     * ceiling, the buffered items are released first and the item starts a new batch; if the record count reaches
     * the ceiling after adding, the buffer (including the item) is released.
     */
    public List<List<T>> add(T item, long itemBytes) {
        List<List<T>> ready = new ArrayList<>(2);
        if (!items.isEmpty() && projected(itemBytes) > maxBytes) {
            ready.add(drain());
        }
        bytes = projected(itemBytes);
        items.add(item);
        if (items.size() >= maxRecords || bytes >= maxBytes) {
            ready.add(drain());
        }
        return ready;
    }

    /** Releases whatever is buffered, if anything. */
    public Optional<List<T>> flush() {
        return items.isEmpty() ? Optional.empty() : Optional.of(drain());
    }

    public int size() { return items.size(); }
    public long bytes() { return items.isEmpty() ? 0 : bytes; }
    public boolean isEmpty() { return items.isEmpty(); }

    private long projected(long itemBytes) {
        return bytes + itemBytes + (items.isEmpty() ? 0 : 1);
    }

    private List<T> drain() {
        List<T> out = items;
        items = new ArrayList<>();
        bytes = 2;
        return out;
    }
}
