package com.flagship.debt_ledger.sync;

import com.flagship.debt_ledger.amortization.AmortizationCalculator;
import com.flagship.debt_ledger.amortization.RepaymentRun;
import com.flagship.debt_ledger.debt.DebtConfiguration;
import com.flagship.debt_ledger.debt.DebtPosition;
import com.flagship.debt_ledger.observability.CorrelationContext;
import com.flagship.debt_ledger.observability.SyncMetrics;
import com.flagship.debt_ledger.repayment.RepaymentLog;
import com.flagship.debt_ledger.repayment.RepaymentLogEntry;
import com.flagship.debt_ledger.repayment.RepaymentLogStore;
import com.flagship.debt_ledger.schedule.RepaymentDueCounter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.flagship.debt_ledger.amortization.AmortizationCalculator.MONEY_CONTEXT;

/**
 * Idempotent catch-up of scheduled repayments against the stored repayment log.
 *
 * Key principles:
 * - Only repayments that became due since the last sync are applied
 * - They are applied to the cached balance, never replayed from the entry balance
 * - The log is written only when something changed, so repeated calls are cheap
 * - Storage failures propagate and are never retried here
 *
 * Sync passes are expected to be serialized by the caller. Two concurrent
 * passes may lose an update, which the next pass corrects because due
 * counts are always recomputed from the entry timestamp.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RepaymentSyncService {

    private final RepaymentLogStore logStore;
    private final AmortizationCalculator calculator;
    private final RepaymentDueCounter dueCounter;
    private final SyncMetrics syncMetrics;
    private final Clock clock;

    public SyncResult syncOne(String positionId, DebtConfiguration config) {
        return syncOne(positionId, config, clock.instant());
    }

    /**
     * Applies the repayments that became due for one position.
     *
     * Archived or paid-off configurations are synced like any other.
     *
     * @param positionId Stable id of the debt position
     * @param config Debt parameters
     * @param now Evaluation instant
     * @return The resulting balance and how many repayments were newly applied
     */
    public SyncResult syncOne(String positionId, DebtConfiguration config, Instant now) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.bindPosition(positionId);

        try {
            RepaymentLog repaymentLog = logStore.load();
            CatchUp catchUp = catchUp(repaymentLog, positionId, config, now);

            if (catchUp.isChanged()) {
                logStore.save(repaymentLog);
            }

            syncMetrics.recordSyncLatency("sync_one", System.currentTimeMillis() - startTime);
            return catchUp.getResult();

        } catch (RuntimeException e) {
            log.error("Failed to sync repayments: error={}", e.getMessage(), e);
            throw e;
        } finally {
            CorrelationContext.unbindPosition();
        }
    }

    public Map<String, SyncResult> syncMany(List<DebtPosition> positions) {
        return syncMany(positions, clock.instant());
    }

    /**
     * Syncs a whole portfolio with a single load and at most a single save.
     *
     * Archived and paid-off positions are skipped and get no result.
     *
     * @param positions Positions to sync, in the order results are returned
     * @param now Evaluation instant
     * @return Results by position id
     */
    public Map<String, SyncResult> syncMany(List<DebtPosition> positions, Instant now) {
        if (positions.isEmpty()) {
            return Collections.emptyMap();
        }

        long startTime = System.currentTimeMillis();
        RepaymentLog repaymentLog = logStore.load();
        Map<String, SyncResult> results = new LinkedHashMap<>();
        boolean changed = false;

        for (DebtPosition position : positions) {
            if (!position.getConfiguration().isAccruing()) {
                syncMetrics.recordPositionSynced(SyncMetrics.OUTCOME_SKIPPED);
                log.debug("Skipping position {}: archived or paid off", position.getPositionId());
                continue;
            }

            CorrelationContext.bindPosition(position.getPositionId());
            try {
                CatchUp catchUp = catchUp(repaymentLog, position.getPositionId(), position.getConfiguration(), now);
                results.put(position.getPositionId(), catchUp.getResult());
                changed |= catchUp.isChanged();
            } finally {
                CorrelationContext.unbindPosition();
            }
        }

        if (changed) {
            logStore.save(repaymentLog);
        }

        syncMetrics.recordSyncLatency("sync_many", System.currentTimeMillis() - startTime);
        log.info("Synced {} of {} debt positions, log written: {}", results.size(), positions.size(), changed);
        return results;
    }

    /**
     * Overwrites the cached balance of a position after a manual correction.
     *
     * The applied count and cumulative totals are kept, so repayments already
     * applied are not applied again to the corrected balance. Without an
     * entry nothing happens and the next sync seeds from the configuration.
     *
     * @param positionId Stable id of the debt position
     * @param newBalance Corrected balance, floored at zero
     * @return true if an entry existed and was reset
     */
    public boolean resetCachedBalance(String positionId, BigDecimal newBalance) {
        RepaymentLog repaymentLog = logStore.load();
        Optional<RepaymentLogEntry> existing = repaymentLog.find(positionId);
        if (existing.isEmpty()) {
            log.debug("No repayment log entry for position {}, nothing to reset", positionId);
            return false;
        }

        RepaymentLogEntry reset = existing.get()
            .withCachedBalance(newBalance.max(BigDecimal.ZERO))
            .withLastSyncedAt(clock.instant());
        repaymentLog.put(reset);
        logStore.save(repaymentLog);

        log.info("Reset cached balance of position {}: appliedCount={}", positionId, reset.getAppliedCount());
        return true;
    }

    /**
     * Brings one entry of the in-memory log up to date.
     */
    private CatchUp catchUp(RepaymentLog repaymentLog, String positionId, DebtConfiguration config, Instant now) {
        Optional<RepaymentLogEntry> existing = repaymentLog.find(positionId);

        int appliedCount = existing.map(RepaymentLogEntry::getAppliedCount).orElse(0);
        BigDecimal startBalance = existing.map(RepaymentLogEntry::getCachedBalance).orElse(config.getEntryBalance());
        BigDecimal priorInterest = existing.map(RepaymentLogEntry::getCumulativeInterest).orElse(BigDecimal.ZERO);
        BigDecimal priorPrincipal = existing.map(RepaymentLogEntry::getCumulativePrincipal).orElse(BigDecimal.ZERO);

        int totalDue = dueCounter.repaymentsDue(
            toDate(config.getEnteredAt()), config.getRepaymentDayOfMonth(), toDate(now));
        int newRepayments = Math.max(0, totalDue - appliedCount);

        RepaymentRun run = calculator.applyRepayments(
            startBalance, config.getAnnualRatePercent(), config.getMonthlyRepayment(), newRepayments);

        BigDecimal balance = run.getFinalBalance().max(BigDecimal.ZERO);
        RepaymentLogEntry updated = new RepaymentLogEntry(
            positionId,
            appliedCount + newRepayments,
            balance,
            priorInterest.add(run.getInterestCharged(), MONEY_CONTEXT),
            priorPrincipal.add(run.getPrincipalPaid(), MONEY_CONTEXT),
            now
        );

        boolean changed = newRepayments > 0 || existing.isEmpty();
        if (changed) {
            repaymentLog.put(updated);
        }

        syncMetrics.recordRepaymentsApplied(newRepayments);
        syncMetrics.recordPositionSynced(outcome(existing.isPresent(), newRepayments));
        if (newRepayments > 0) {
            log.info("Applied {} repayments to position {}: balance={}", newRepayments, positionId, balance);
        }

        SyncResult result = new SyncResult(
            positionId,
            balance,
            newRepayments,
            updated.getAppliedCount(),
            updated.getCumulativeInterest(),
            updated.getCumulativePrincipal(),
            balance.compareTo(AmortizationCalculator.PAYOFF_THRESHOLD) <= 0
        );
        return new CatchUp(result, changed);
    }

    private String outcome(boolean hadEntry, int newRepayments) {
        if (newRepayments > 0) {
            return SyncMetrics.OUTCOME_APPLIED;
        }
        return hadEntry ? SyncMetrics.OUTCOME_UNCHANGED : SyncMetrics.OUTCOME_SEEDED;
    }

    private LocalDate toDate(Instant instant) {
        return LocalDate.ofInstant(instant, clock.getZone());
    }

    @lombok.Value
    private static class CatchUp {
        SyncResult result;
        boolean changed;
    }
}
