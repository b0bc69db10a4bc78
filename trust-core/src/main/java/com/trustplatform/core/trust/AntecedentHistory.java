package com.trustplatform.core.trust;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only, capped log of antecedents for one direction of a relationship.
 *
 * <p>When the log exceeds its capacity it is sorted by timestamp and the oldest
 * entries are evicted. Entries are otherwise kept in arrival order.
 */
public final class AntecedentHistory {

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final List<TrustAntecedent> entries = new ArrayList<>();
    private Instant lastNegative;

    public AntecedentHistory() {
        this(DEFAULT_CAPACITY);
    }

    public AntecedentHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void append(TrustAntecedent antecedent) {
        if (antecedent.isNegative()) {
            lastNegative = antecedent.timestamp();
        }
        entries.add(antecedent);
        if (entries.size() > capacity) {
            entries.sort(Comparator.comparing(TrustAntecedent::timestamp));
            entries.subList(0, entries.size() - capacity).clear();
        }
    }

    public List<TrustAntecedent> entries() {
        return Collections.unmodifiableList(entries);
    }

    /** Timestamp of the most recently appended negative antecedent. */
    public Optional<Instant> lastNegative() {
        return Optional.ofNullable(lastNegative);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AntecedentHistory that)) return false;
        return capacity == that.capacity
            && entries.equals(that.entries)
            && Objects.equals(lastNegative, that.lastNegative);
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacity, entries, lastNegative);
    }
}
