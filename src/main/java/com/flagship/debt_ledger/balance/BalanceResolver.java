package com.flagship.debt_ledger.balance;

import com.flagship.debt_ledger.amortization.AmortizationCalculator;
import com.flagship.debt_ledger.amortization.RepaymentRun;
import com.flagship.debt_ledger.amortization.RepaymentStep;
import com.flagship.debt_ledger.debt.DebtConfiguration;
import com.flagship.debt_ledger.schedule.LoanProgress;
import com.flagship.debt_ledger.schedule.LoanProgressCalculator;
import com.flagship.debt_ledger.schedule.RepaymentDueCounter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static com.flagship.debt_ledger.amortization.AmortizationCalculator.MONEY_CONTEXT;

/**
 * Stateless balance resolution.
 *
 * Rebuilds the balance by replaying every repayment from the entry balance,
 * so it needs no stored state beyond the applied count. The cached,
 * incremental variant is {@link com.flagship.debt_ledger.sync.RepaymentSyncService}.
 *
 * Instants are turned into calendar dates in the zone of the injected clock.
 */
@Service
@RequiredArgsConstructor
public class BalanceResolver {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AmortizationCalculator calculator;
    private final RepaymentDueCounter dueCounter;
    private final LoanProgressCalculator progressCalculator;
    private final Clock clock;

    public DebtBalanceResult currentBalance(DebtConfiguration config, int appliedCount) {
        return currentBalance(config, appliedCount, clock.instant());
    }

    /**
     * Calculates the balance after every repayment due by {@code now}.
     *
     * Replays the {@code appliedCount} repayments already applied, then the
     * ones that became due since, stopping the moment the debt is cleared.
     *
     * @param config Debt parameters
     * @param appliedCount Repayments already applied and persisted by the caller
     * @param now Evaluation instant
     * @return Balance, accrued totals, months to payoff and loan progress
     */
    public DebtBalanceResult currentBalance(DebtConfiguration config, int appliedCount, Instant now) {
        LocalDate today = toDate(now);
        int alreadyApplied = Math.max(0, appliedCount);
        int totalDue = dueCounter.repaymentsDue(
            toDate(config.getEnteredAt()), config.getRepaymentDayOfMonth(), today);
        int newRepayments = Math.max(0, totalDue - alreadyApplied);

        RepaymentRun replayed = calculator.applyRepayments(
            config.getEntryBalance(), config.getAnnualRatePercent(), config.getMonthlyRepayment(), alreadyApplied);
        BigDecimal balance = replayed.getFinalBalance();
        BigDecimal interest = replayed.getInterestCharged();
        BigDecimal principal = replayed.getPrincipalPaid();

        if (!replayed.isPaidOff()) {
            RepaymentRun caughtUp = calculator.applyRepayments(
                balance, config.getAnnualRatePercent(), config.getMonthlyRepayment(), newRepayments);
            balance = caughtUp.getFinalBalance();
            interest = interest.add(caughtUp.getInterestCharged(), MONEY_CONTEXT);
            principal = principal.add(caughtUp.getPrincipalPaid(), MONEY_CONTEXT);
        }

        boolean paidOff = balance.compareTo(AmortizationCalculator.PAYOFF_THRESHOLD) <= 0;

        Integer monthsToPayoff = null;
        if (!paidOff && config.getMonthlyRepayment().signum() > 0) {
            monthsToPayoff = monthsToPayoff(calculator.projectSchedule(
                balance, config.getAnnualRatePercent(), config.getMonthlyRepayment()));
        }

        LoanProgress loanProgress = null;
        if (config.hasLoanTerm()) {
            loanProgress = progressCalculator.loanProgress(config.getLoanStartDate(), config.getLoanEndDate(), today);
        }

        return new DebtBalanceResult(
            balance.max(BigDecimal.ZERO),
            interest,
            principal,
            alreadyApplied + newRepayments,
            paidOff,
            monthsToPayoff,
            loanProgress
        );
    }

    public DebtSummary summary(DebtConfiguration config, int appliedCount) {
        return summary(config, appliedCount, clock.instant());
    }

    /**
     * Builds the display summary for a debt.
     *
     * @param config Debt parameters
     * @param appliedCount Repayments already applied
     * @param now Evaluation instant
     * @return Summary with paid-off percentage and estimated payoff date
     */
    public DebtSummary summary(DebtConfiguration config, int appliedCount, Instant now) {
        DebtBalanceResult result = currentBalance(config, appliedCount, now);

        BigDecimal originalBalance = config.getEntryBalance();
        BigDecimal totalRepaid = result.getTotalPrincipalRepaid();
        double paidOffPercent = 0.0;
        if (originalBalance.signum() > 0) {
            paidOffPercent = Math.min(100.0,
                totalRepaid.multiply(HUNDRED).divide(originalBalance, MONEY_CONTEXT).doubleValue());
        }

        LocalDate estimatedPayoffDate = null;
        if (result.getMonthsToPayoff() != null) {
            estimatedPayoffDate = toDate(now).plusMonths(result.getMonthsToPayoff());
        }

        return DebtSummary.builder()
            .balance(result.getCurrentBalance())
            .monthlyRepayment(config.getMonthlyRepayment())
            .annualRatePercent(config.getAnnualRatePercent())
            .paidOffPercent(paidOffPercent)
            .totalRepaid(totalRepaid)
            .monthsToPayoff(result.getMonthsToPayoff())
            .estimatedPayoffDate(estimatedPayoffDate)
            .paidOff(result.isPaidOff())
            .loanProgress(result.getLoanProgress())
            .build();
    }

    private Integer monthsToPayoff(List<RepaymentStep> schedule) {
        if (schedule.isEmpty() || !schedule.get(schedule.size() - 1).isPaidOff()) {
            return null;
        }
        return schedule.size();
    }

    private LocalDate toDate(Instant instant) {
        return LocalDate.ofInstant(instant, clock.getZone());
    }
}
