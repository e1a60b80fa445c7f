package com.flagship.debt_ledger.balance;

import com.flagship.debt_ledger.schedule.LoanProgress;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Display-oriented view of a debt position.
 */
@Value
@Builder
public class DebtSummary {
    BigDecimal balance;
    BigDecimal monthlyRepayment;
    BigDecimal annualRatePercent;
    /** Share of the entry balance repaid, 0 to 100 */
    double paidOffPercent;
    BigDecimal totalRepaid;
    Integer monthsToPayoff;
    LocalDate estimatedPayoffDate;
    boolean paidOff;
    LoanProgress loanProgress;
}
