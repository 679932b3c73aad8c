package com.tradecore.marketdata;

import com.tradecore.domain.model.PriceSample;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Rolling per-symbol price window shared by the ingestion loops (writers) and the
 * decision loop (reader).
 *
 * <p>Each symbol keeps at most {@code capacity} samples in arrival order. Appending
 * beyond the cap evicts the oldest sample (FIFO window, not a cache).
 *
 * <p><b>Thread safety:</b> a single {@link ReentrantReadWriteLock} guards the map and
 * every deque. Writers hold the write lock only for append+trim; readers hold the read
 * lock only while copying. Snapshots are immutable copies, so strategy evaluation never
 * runs under the lock and never observes a partial write.
 */
@Component
public class PriceHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(PriceHistoryStore.class);

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Map<String, Deque<PriceSample>> history = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public PriceHistoryStore(@Value("${tradecore.history.capacity:1000}") int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Appends a sample to the symbol's window, evicting the oldest samples once the
     * window exceeds the capacity.
     */
    public void record(String symbol, PriceSample sample) {
        lock.writeLock().lock();
        try {
            Deque<PriceSample> samples = history.computeIfAbsent(symbol, s -> new ArrayDeque<>());
            samples.addLast(sample);
            while (samples.size() > capacity) {
                samples.pollFirst();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns an immutable copy of the symbol's window, oldest first.
     * Unknown symbols yield an empty list.
     */
    public List<PriceSample> snapshot(String symbol) {
        lock.readLock().lock();
        try {
            Deque<PriceSample> samples = history.get(symbol);
            return samples == null ? List.of() : List.copyOf(samples);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Symbols with at least one recorded sample, in no particular order. */
    public List<String> symbols() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(history.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size(String symbol) {
        lock.readLock().lock();
        try {
            Deque<PriceSample> samples = history.get(symbol);
            return samples == null ? 0 : samples.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    /** Drops every window. Used between engine runs in tests and by operators. */
    public void clear() {
        lock.writeLock().lock();
        try {
            history.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Price history cleared");
    }
}
