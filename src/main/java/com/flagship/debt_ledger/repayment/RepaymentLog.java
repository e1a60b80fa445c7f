package com.flagship.debt_ledger.repayment;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * All repayment log entries, unique by position id, plus the time of the last write.
 *
 * Loaded whole, mutated in memory and written back whole by {@link RepaymentLogStore}.
 * Not thread-safe.
 */
public class RepaymentLog {

    private final Map<String, RepaymentLogEntry> entries = new LinkedHashMap<>();
    private Instant updatedAt;

    public RepaymentLog(Collection<RepaymentLogEntry> entries, Instant updatedAt) {
        entries.forEach(this::put);
        this.updatedAt = updatedAt;
    }

    /**
     * A log with no entries, as if nothing had ever been synced.
     */
    public static RepaymentLog empty(Instant now) {
        return new RepaymentLog(Collections.emptyList(), now);
    }

    public Optional<RepaymentLogEntry> find(String positionId) {
        return Optional.ofNullable(entries.get(positionId));
    }

    /**
     * Adds the entry, replacing any entry for the same position.
     */
    public void put(RepaymentLogEntry entry) {
        entries.put(entry.getPositionId(), entry);
    }

    /**
     * @return true if an entry was removed
     */
    public boolean remove(String positionId) {
        return entries.remove(positionId) != null;
    }

    /**
     * Drops every entry whose position is not in {@code activePositionIds}.
     *
     * @return Number of entries dropped
     */
    public int retainOnly(Set<String> activePositionIds) {
        int before = entries.size();
        entries.keySet().retainAll(activePositionIds);
        return before - entries.size();
    }

    public Collection<RepaymentLogEntry> getEntries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    void stampUpdatedAt(Instant instant) {
        this.updatedAt = instant;
    }
}
