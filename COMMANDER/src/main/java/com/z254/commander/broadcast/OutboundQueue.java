package com.z254.commander.broadcast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Bounded FIFO of messages waiting to be written to one connection.
 * <p>
 * Offering to a full queue evicts the oldest unpinned entry, so producers never wait on a
 * slow consumer. Eviction only happens on offer; {@link #drain()} hands out whatever is
 * queued at that moment.
 */
public class OutboundQueue {

    private final int capacity;
    private final Deque<QueuedMessage> entries;

    public OutboundQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    /**
     * Appends an entry.
     *
     * @return the evicted entry when the queue was full
     */
    public synchronized Optional<QueuedMessage> offer(QueuedMessage entry) {
        QueuedMessage evicted = null;
        if (entries.size() >= capacity) {
            evicted = evictOldest();
        }
        entries.addLast(entry);
        return Optional.ofNullable(evicted);
    }

    private QueuedMessage evictOldest() {
        Iterator<QueuedMessage> it = entries.iterator();
        while (it.hasNext()) {
            QueuedMessage candidate = it.next();
            if (!candidate.isPinned()) {
                it.remove();
                return candidate;
            }
        }
        return entries.pollFirst();
    }

    /**
     * Removes and returns all queued entries, oldest first.
     */
    public synchronized List<QueuedMessage> drain() {
        List<QueuedMessage> drained = new ArrayList<>(entries);
        entries.clear();
        return drained;
    }

    /**
     * Queued entries, oldest first, without removing them.
     */
    public synchronized List<QueuedMessage> snapshot() {
        return new ArrayList<>(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Empties the queue.
     *
     * @return the entries that were still waiting
     */
    public synchronized List<QueuedMessage> clear() {
        return drain();
    }

    public int capacity() {
        return capacity;
    }
}
