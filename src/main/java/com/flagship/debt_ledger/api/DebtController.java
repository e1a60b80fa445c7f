package com.flagship.debt_ledger.api;

import com.flagship.debt_ledger.api.dto.CachedBalanceRequest;
import com.flagship.debt_ledger.api.dto.DebtConfigurationRequest;
import com.flagship.debt_ledger.api.dto.DebtPositionRequest;
import com.flagship.debt_ledger.api.dto.DebtSummaryResponse;
import com.flagship.debt_ledger.api.dto.PruneRequest;
import com.flagship.debt_ledger.api.dto.PruneResponse;
import com.flagship.debt_ledger.api.dto.RepaymentLogEntryResponse;
import com.flagship.debt_ledger.api.dto.SyncBatchRequest;
import com.flagship.debt_ledger.api.dto.SyncResponse;
import com.flagship.debt_ledger.api.exception.RepaymentLogEntryNotFoundException;
import com.flagship.debt_ledger.balance.BalanceResolver;
import com.flagship.debt_ledger.balance.DebtSummary;
import com.flagship.debt_ledger.debt.DebtPosition;
import com.flagship.debt_ledger.observability.CorrelationContext;
import com.flagship.debt_ledger.repayment.RepaymentLogStore;
import com.flagship.debt_ledger.sync.RepaymentSyncService;
import com.flagship.debt_ledger.sync.SyncResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST Controller for repayment sync and the repayment log.
 *
 * Every evaluating endpoint accepts an optional {@code as_of} instant and
 * falls back to the service clock.
 */
@RestController
@RequestMapping("/api/debts")
@RequiredArgsConstructor
@Slf4j
public class DebtController {

    private final RepaymentSyncService syncService;
    private final BalanceResolver balanceResolver;
    private final RepaymentLogStore logStore;
    private final Clock clock;

    /**
     * Applies the repayments that became due for one position.
     */
    @PostMapping("/{positionId}/sync")
    public ResponseEntity<SyncResponse> syncOne(
            @PathVariable("positionId") String positionId,
            @Valid @RequestBody DebtConfigurationRequest request,
            @RequestParam(value = "as_of", required = false) Instant asOf) {

        SyncResult result = syncService.syncOne(positionId, request.toConfiguration(), evaluationTime(asOf));
        return ResponseEntity.ok(SyncResponse.from(result));
    }

    /**
     * Syncs every position of a portfolio in one pass.
     * Archived and paid-off positions are left out of the response.
     */
    @PostMapping("/sync")
    public ResponseEntity<List<SyncResponse>> syncMany(
            @Valid @RequestBody SyncBatchRequest request,
            @RequestParam(value = "as_of", required = false) Instant asOf) {

        List<DebtPosition> positions = request.getPositions().stream()
            .map(DebtPositionRequest::toPosition)
            .collect(Collectors.toList());

        Map<String, SyncResult> results = syncService.syncMany(positions, evaluationTime(asOf));
        return ResponseEntity.ok(results.values().stream()
            .map(SyncResponse::from)
            .collect(Collectors.toList()));
    }

    /**
     * Summarizes a position, counting the repayments already recorded for it.
     */
    @PostMapping("/{positionId}/summary")
    public ResponseEntity<DebtSummaryResponse> summary(
            @PathVariable("positionId") String positionId,
            @Valid @RequestBody DebtConfigurationRequest request,
            @RequestParam(value = "as_of", required = false) Instant asOf) {

        CorrelationContext.bindPosition(positionId);
        try {
            int appliedCount = logStore.appliedCount(positionId);
            DebtSummary summary = balanceResolver.summary(request.toConfiguration(), appliedCount, evaluationTime(asOf));
            log.debug("Built summary with {} recorded repayments", appliedCount);
            return ResponseEntity.ok(DebtSummaryResponse.from(positionId, summary));
        } finally {
            CorrelationContext.unbindPosition();
        }
    }

    @GetMapping("/{positionId}/repayment-log")
    public ResponseEntity<RepaymentLogEntryResponse> getEntry(@PathVariable("positionId") String positionId) {
        return logStore.entry(positionId)
            .map(entry -> ResponseEntity.ok(RepaymentLogEntryResponse.from(entry)))
            .orElseThrow(() -> new RepaymentLogEntryNotFoundException(positionId));
    }

    /**
     * Records a manual balance correction without forgetting applied repayments.
     */
    @PutMapping("/{positionId}/cached-balance")
    public ResponseEntity<RepaymentLogEntryResponse> resetCachedBalance(
            @PathVariable("positionId") String positionId,
            @Valid @RequestBody CachedBalanceRequest request) {

        if (!syncService.resetCachedBalance(positionId, request.getBalance())) {
            throw new RepaymentLogEntryNotFoundException(positionId);
        }
        return getEntry(positionId);
    }

    @DeleteMapping("/{positionId}/repayment-log")
    public ResponseEntity<Void> removeEntry(@PathVariable("positionId") String positionId) {
        logStore.remove(positionId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/repayment-log/prune")
    public ResponseEntity<PruneResponse> prune(@Valid @RequestBody PruneRequest request) {
        int pruned = logStore.prune(request.getActivePositionIds());
        return ResponseEntity.ok(new PruneResponse(pruned));
    }

    /**
     * Deletes the whole repayment log. Every position is re-seeded on its next sync.
     */
    @DeleteMapping("/repayment-log")
    public ResponseEntity<Void> clear() {
        log.warn("Clearing repayment log on request");
        logStore.clear();
        return ResponseEntity.noContent().build();
    }

    private Instant evaluationTime(Instant asOf) {
        return asOf != null ? asOf : clock.instant();
    }
}
