package com.flagship.debt_ledger.repayment;

import com.flagship.debt_ledger.observability.SyncMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence boundary for the repayment log.
 *
 * The whole log lives under one namespaced key, separate from portfolio
 * storage. A missing or corrupt document loads as an empty log; storage
 * failures propagate to the caller untouched.
 *
 * Reads and writes are not synchronized: two concurrent read-modify-write
 * cycles can lose an update. The owning layer serializes sync passes.
 */
@Service
@Slf4j
public class RepaymentLogStore {

    public static final String DEFAULT_STORAGE_KEY = "debt-repayments";

    private final RepaymentLogStorage storage;
    private final RepaymentLogCodec codec;
    private final SyncMetrics syncMetrics;
    private final Clock clock;
    private final String storageKey;

    public RepaymentLogStore(RepaymentLogStorage storage,
                             RepaymentLogCodec codec,
                             SyncMetrics syncMetrics,
                             Clock clock,
                             @Value("${debt.repayment-log.storage-key:" + DEFAULT_STORAGE_KEY + "}") String storageKey) {
        this.storage = storage;
        this.codec = codec;
        this.syncMetrics = syncMetrics;
        this.clock = clock;
        this.storageKey = storageKey;
    }

    /**
     * Loads the repayment log.
     *
     * @return The stored log, or an empty one if nothing is stored or the
     *         stored document cannot be read back
     */
    public RepaymentLog load() {
        Optional<String> document = storage.read(storageKey);
        if (document.isEmpty()) {
            return RepaymentLog.empty(clock.instant());
        }

        Optional<RepaymentLog> decoded = codec.decode(document.get());
        if (decoded.isEmpty()) {
            syncMetrics.recordDegradedLoad();
            log.warn("Discarding unreadable repayment log under key {}, continuing with an empty log", storageKey);
            return RepaymentLog.empty(clock.instant());
        }
        return decoded.get();
    }

    /**
     * Persists the log, stamping its last-write time.
     * Entry sync timestamps are left as set by the caller.
     */
    public void save(RepaymentLog repaymentLog) {
        repaymentLog.stampUpdatedAt(clock.instant());
        storage.write(storageKey, codec.encode(repaymentLog));
        log.debug("Saved repayment log with {} entries", repaymentLog.size());
    }

    /**
     * Read-only lookup, no syncing.
     */
    public Optional<RepaymentLogEntry> entry(String positionId) {
        return load().find(positionId);
    }

    /**
     * @return Repayments applied to the position, 0 if it was never synced
     */
    public int appliedCount(String positionId) {
        return entry(positionId).map(RepaymentLogEntry::getAppliedCount).orElse(0);
    }

    /**
     * Removes the entry of a deleted position.
     *
     * @return true if an entry existed
     */
    public boolean remove(String positionId) {
        RepaymentLog repaymentLog = load();
        if (!repaymentLog.remove(positionId)) {
            return false;
        }
        save(repaymentLog);
        log.info("Removed repayment log entry for position {}", positionId);
        return true;
    }

    /**
     * Removes entries of positions no longer in the portfolio.
     *
     * @param activePositionIds Ids of every position still present
     * @return Number of entries removed
     */
    public int prune(Set<String> activePositionIds) {
        RepaymentLog repaymentLog = load();
        int pruned = repaymentLog.retainOnly(activePositionIds);
        if (pruned > 0) {
            save(repaymentLog);
            log.info("Pruned {} orphaned repayment log entries", pruned);
        }
        return pruned;
    }

    /**
     * Deletes the whole log. All repayment tracking is lost.
     */
    public void clear() {
        storage.delete(storageKey);
        log.warn("Cleared repayment log under key {}", storageKey);
    }
}
