package com.flagship.debt_ledger.amortization;

import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pure amortization maths: fixed payments, monthly accrual and schedule projection.
 *
 * Formulas:
 * - Amortized payment: M = P * r(1+r)^n / ((1+r)^n - 1), r = APR / 12 / 100
 * - Monthly update: newBalance = balance * (1 + r) - repayment
 *
 * Every method returns a defined result for any input. Validation of
 * principals, rates and terms belongs to the caller.
 */
@Service
public class AmortizationCalculator {

    /**
     * Precision used for all intermediate money arithmetic.
     */
    public static final MathContext MONEY_CONTEXT = MathContext.DECIMAL64;

    /**
     * A balance at or below this after a repayment is treated as fully repaid.
     * Absorbs sub-cent rounding residue.
     */
    public static final BigDecimal PAYOFF_THRESHOLD = new BigDecimal("0.01");

    /**
     * Projection cap (50 years) so schedules terminate even when the
     * repayment never covers the interest.
     */
    public static final int DEFAULT_MAX_MONTHS = 600;

    private static final BigDecimal MONTHS_TIMES_PERCENT = BigDecimal.valueOf(1200);

    /**
     * Calculates the fixed monthly payment that clears {@code principal} in
     * {@code totalMonths} payments.
     *
     * @param principal Loan amount
     * @param annualRatePercent APR as a percentage (5.5 means 5.5%)
     * @param totalMonths Number of monthly payments
     * @return Monthly payment, principal / totalMonths for interest-free loans
     *         and for rates too small to compound, zero when principal or term is not positive
     */
    public BigDecimal amortizedPayment(BigDecimal principal, BigDecimal annualRatePercent, int totalMonths) {
        if (totalMonths <= 0 || principal.signum() <= 0) {
            return BigDecimal.ZERO;
        }

        BigDecimal months = BigDecimal.valueOf(totalMonths);
        if (annualRatePercent.signum() <= 0) {
            return principal.divide(months, MONEY_CONTEXT);
        }

        BigDecimal r = monthlyRate(annualRatePercent);
        BigDecimal factor = BigDecimal.ONE.add(r).pow(totalMonths, MONEY_CONTEXT);
        if (factor.compareTo(BigDecimal.ONE) == 0) {
            // Rate below the working precision compounds to nothing
            return principal.divide(months, MONEY_CONTEXT);
        }
        return principal.multiply(r, MONEY_CONTEXT)
            .multiply(factor, MONEY_CONTEXT)
            .divide(factor.subtract(BigDecimal.ONE), MONEY_CONTEXT);
    }

    /**
     * Applies one month of interest followed by one repayment.
     *
     * A repayment covering balance plus interest clears the debt to exactly
     * zero and attributes the whole remaining balance to principal.
     *
     * @param balance Outstanding balance before the month
     * @param annualRatePercent APR as a percentage
     * @param monthlyRepayment Fixed monthly repayment
     * @return The updated balance with interest and principal split
     */
    public MonthlyUpdateResult applyMonthlyUpdate(BigDecimal balance, BigDecimal annualRatePercent,
                                                  BigDecimal monthlyRepayment) {
        if (balance.signum() <= 0) {
            return MonthlyUpdateResult.alreadyPaidOff();
        }

        BigDecimal interestCharged = balance.multiply(monthlyRate(annualRatePercent), MONEY_CONTEXT);
        BigDecimal balanceWithInterest = balance.add(interestCharged, MONEY_CONTEXT);

        if (monthlyRepayment.compareTo(balanceWithInterest) >= 0) {
            // Final payment
            return new MonthlyUpdateResult(BigDecimal.ZERO, interestCharged, balance, true);
        }

        // Repayment below the interest would give negative principal
        BigDecimal principalPaid = monthlyRepayment.subtract(interestCharged, MONEY_CONTEXT).max(BigDecimal.ZERO);
        BigDecimal newBalance = balanceWithInterest.subtract(monthlyRepayment, MONEY_CONTEXT);

        return new MonthlyUpdateResult(
            newBalance.max(BigDecimal.ZERO),
            interestCharged,
            principalPaid,
            newBalance.compareTo(PAYOFF_THRESHOLD) <= 0
        );
    }

    /**
     * Applies up to {@code count} consecutive monthly updates, stopping as
     * soon as the debt is paid off.
     */
    public RepaymentRun applyRepayments(BigDecimal balance, BigDecimal annualRatePercent,
                                        BigDecimal monthlyRepayment, int count) {
        BigDecimal current = balance;
        BigDecimal interest = BigDecimal.ZERO;
        BigDecimal principal = BigDecimal.ZERO;
        int performed = 0;
        boolean paidOff = false;

        while (performed < count && !paidOff) {
            MonthlyUpdateResult result = applyMonthlyUpdate(current, annualRatePercent, monthlyRepayment);
            interest = interest.add(result.getInterestCharged(), MONEY_CONTEXT);
            principal = principal.add(result.getPrincipalPaid(), MONEY_CONTEXT);
            current = result.getNewBalance();
            paidOff = result.isPaidOff();
            performed++;
        }

        return new RepaymentRun(current, interest, principal, performed, paidOff);
    }

    /**
     * Projects the schedule with the default cap of {@value #DEFAULT_MAX_MONTHS} months.
     */
    public List<RepaymentStep> projectSchedule(BigDecimal balance, BigDecimal annualRatePercent,
                                               BigDecimal monthlyRepayment) {
        return projectSchedule(balance, annualRatePercent, monthlyRepayment, DEFAULT_MAX_MONTHS);
    }

    /**
     * Projects the month-by-month schedule until the debt is paid off or
     * {@code maxMonths} is reached.
     *
     * A repayment that never covers the interest yields exactly
     * {@code maxMonths} steps, the last of which is not paid off.
     *
     * @return Immutable list of steps, empty when there is nothing to repay
     *         or no repayment
     */
    public List<RepaymentStep> projectSchedule(BigDecimal balance, BigDecimal annualRatePercent,
                                               BigDecimal monthlyRepayment, int maxMonths) {
        if (balance.signum() <= 0 || monthlyRepayment.signum() <= 0) {
            return Collections.emptyList();
        }

        List<RepaymentStep> steps = new ArrayList<>();
        BigDecimal current = balance;
        BigDecimal cumulativeInterest = BigDecimal.ZERO;
        BigDecimal cumulativePrincipal = BigDecimal.ZERO;

        for (int month = 1; month <= maxMonths; month++) {
            MonthlyUpdateResult result = applyMonthlyUpdate(current, annualRatePercent, monthlyRepayment);
            cumulativeInterest = cumulativeInterest.add(result.getInterestCharged(), MONEY_CONTEXT);
            cumulativePrincipal = cumulativePrincipal.add(result.getPrincipalPaid(), MONEY_CONTEXT);

            steps.add(new RepaymentStep(
                month,
                result.getNewBalance(),
                result.getInterestCharged(),
                result.getPrincipalPaid(),
                cumulativeInterest,
                cumulativePrincipal,
                result.isPaidOff()
            ));

            current = result.getNewBalance();
            if (result.isPaidOff()) {
                break;
            }
        }

        return Collections.unmodifiableList(steps);
    }

    private BigDecimal monthlyRate(BigDecimal annualRatePercent) {
        return annualRatePercent.divide(MONTHS_TIMES_PERCENT, MONEY_CONTEXT);
    }
}
