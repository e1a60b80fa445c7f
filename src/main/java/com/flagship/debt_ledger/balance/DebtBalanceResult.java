package com.flagship.debt_ledger.balance;

import com.flagship.debt_ledger.schedule.LoanProgress;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Current balance of a debt and the totals accrued since it was entered.
 */
@Value
public class DebtBalanceResult {
    BigDecimal currentBalance;
    BigDecimal totalInterestAccrued;
    BigDecimal totalPrincipalRepaid;
    int repaymentsApplied;
    boolean paidOff;
    /** Null when paid off, when there is no repayment, or when the debt never clears */
    Integer monthsToPayoff;
    /** Null unless the debt has loan term dates */
    LoanProgress loanProgress;
}
