package com.flagship.debt_ledger.amortization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for amortized payments, monthly accrual and schedule projection.
 */
class AmortizationCalculatorTest {

    private final AmortizationCalculator calculator = new AmortizationCalculator();

    private static BigDecimal money(String value) {
        return new BigDecimal(value);
    }

    private static BigDecimal cents(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @Nested
    @DisplayName("Amortized payment")
    class AmortizedPayment {

        @Test
        @DisplayName("Standard loan uses the amortization formula")
        void standardLoan() {
            printTestHeader("Amortized payment: 10000 at 5.5% over 60 months");

            BigDecimal payment = calculator.amortizedPayment(money("10000"), money("5.5"), 60);

            printOutput("Monthly payment", payment);
            assertEquals(0, money("191.01").compareTo(cents(payment)));
        }

        @Test
        @DisplayName("Interest-free loan divides the principal evenly")
        void interestFree() {
            BigDecimal payment = calculator.amortizedPayment(money("1200"), BigDecimal.ZERO, 12);

            assertEquals(0, money("100").compareTo(payment));
        }

        @Test
        @DisplayName("Rate too small to compound is treated as interest-free")
        void negligibleRate() {
            BigDecimal payment = assertDoesNotThrow(
                () -> calculator.amortizedPayment(money("10000"), new BigDecimal("1E-15"), 60));

            assertEquals(0, money("10000").divide(BigDecimal.valueOf(60), AmortizationCalculator.MONEY_CONTEXT)
                .compareTo(payment));
        }

        @Test
        @DisplayName("Non-positive term or principal gives zero")
        void degenerateInputs() {
            assertEquals(0, BigDecimal.ZERO.compareTo(calculator.amortizedPayment(money("1000"), money("5"), 0)));
            assertEquals(0, BigDecimal.ZERO.compareTo(calculator.amortizedPayment(money("1000"), money("5"), -3)));
            assertEquals(0, BigDecimal.ZERO.compareTo(calculator.amortizedPayment(BigDecimal.ZERO, money("5"), 12)));
            assertEquals(0, BigDecimal.ZERO.compareTo(calculator.amortizedPayment(money("-50"), money("5"), 12)));
        }

        @Test
        @DisplayName("Paying the amortized amount clears the loan in exactly the term")
        void amortizedPaymentClearsInTerm() {
            BigDecimal payment = calculator.amortizedPayment(money("10000"), money("5.5"), 60);

            List<RepaymentStep> schedule = calculator.projectSchedule(money("10000"), money("5.5"), payment);

            assertEquals(60, schedule.size());
            assertTrue(schedule.get(59).isPaidOff());
        }
    }

    @Nested
    @DisplayName("Monthly update")
    class MonthlyUpdate {

        @Test
        @DisplayName("Interest accrues before the repayment is taken")
        void interestThenRepayment() {
            printTestHeader("Monthly update: 5000 at 19.9% with 200 repayment");

            MonthlyUpdateResult result = calculator.applyMonthlyUpdate(money("5000"), money("19.9"), money("200"));

            printOutput("Interest", result.getInterestCharged());
            printOutput("Principal", result.getPrincipalPaid());
            printOutput("New balance", result.getNewBalance());

            assertEquals(0, money("82.92").compareTo(cents(result.getInterestCharged())));
            assertEquals(0, money("117.08").compareTo(cents(result.getPrincipalPaid())));
            assertEquals(0, money("4882.92").compareTo(cents(result.getNewBalance())));
            assertFalse(result.isPaidOff());
        }

        @Test
        @DisplayName("Repayment covering balance plus interest clears to exactly zero")
        void finalPayment() {
            MonthlyUpdateResult result = calculator.applyMonthlyUpdate(money("150"), BigDecimal.ZERO, money("200"));

            assertTrue(result.isPaidOff());
            assertEquals(0, BigDecimal.ZERO.compareTo(result.getNewBalance()));
            assertEquals(0, money("150").compareTo(result.getPrincipalPaid()));
            assertEquals(0, BigDecimal.ZERO.compareTo(result.getInterestCharged()));
        }

        @Test
        @DisplayName("Zero or negative balance is already paid off")
        void alreadyPaidOff() {
            MonthlyUpdateResult zero = calculator.applyMonthlyUpdate(BigDecimal.ZERO, money("10"), money("100"));
            MonthlyUpdateResult negative = calculator.applyMonthlyUpdate(money("-5"), money("10"), money("100"));

            assertTrue(zero.isPaidOff());
            assertTrue(negative.isPaidOff());
            assertEquals(0, BigDecimal.ZERO.compareTo(negative.getNewBalance()));
            assertEquals(0, BigDecimal.ZERO.compareTo(negative.getPrincipalPaid()));
        }

        @Test
        @DisplayName("Repayment below the interest grows the balance with zero principal")
        void repaymentBelowInterest() {
            // 1000 at 24% accrues 20 a month
            MonthlyUpdateResult result = calculator.applyMonthlyUpdate(money("1000"), money("24"), money("15"));

            assertEquals(0, BigDecimal.ZERO.compareTo(result.getPrincipalPaid()));
            assertEquals(0, money("1005").compareTo(result.getNewBalance()));
            assertFalse(result.isPaidOff());
        }

        @Test
        @DisplayName("Sub-cent residue counts as paid off")
        void subCentResidue() {
            MonthlyUpdateResult result = calculator.applyMonthlyUpdate(money("100.005"), BigDecimal.ZERO, money("100"));

            assertTrue(result.isPaidOff());
            assertEquals(0, money("0.005").compareTo(result.getNewBalance()));
        }
    }

    @Nested
    @DisplayName("Repayment runs")
    class Runs {

        @Test
        @DisplayName("Applies the requested number of updates")
        void appliesCount() {
            RepaymentRun run = calculator.applyRepayments(money("1000"), money("12"), money("100"), 3);

            assertEquals(3, run.getUpdatesPerformed());
            assertEquals(0, money("727.291").compareTo(run.getFinalBalance()));
            assertEquals(0, money("27.291").compareTo(run.getInterestCharged()));
            assertEquals(0, money("272.709").compareTo(run.getPrincipalPaid()));
            assertFalse(run.isPaidOff());
        }

        @Test
        @DisplayName("Stops at payoff even when more updates were requested")
        void stopsAtPayoff() {
            RepaymentRun run = calculator.applyRepayments(money("250"), BigDecimal.ZERO, money("100"), 10);

            assertEquals(3, run.getUpdatesPerformed());
            assertTrue(run.isPaidOff());
            assertEquals(0, BigDecimal.ZERO.compareTo(run.getFinalBalance()));
            assertEquals(0, money("250").compareTo(run.getPrincipalPaid()));
        }

        @Test
        @DisplayName("Zero count leaves the balance untouched")
        void zeroCount() {
            RepaymentRun run = calculator.applyRepayments(money("1000"), money("12"), money("100"), 0);

            assertEquals(0, run.getUpdatesPerformed());
            assertEquals(0, money("1000").compareTo(run.getFinalBalance()));
        }
    }

    @Nested
    @DisplayName("Schedule projection")
    class Schedule {

        @Test
        @DisplayName("Interest-free instalment plan pays off in six steps")
        void interestFreeInstalments() {
            List<RepaymentStep> schedule = calculator.projectSchedule(money("600"), BigDecimal.ZERO, money("100"));

            assertEquals(6, schedule.size());
            assertTrue(schedule.get(5).isPaidOff());
            assertEquals(0, money("600").compareTo(schedule.get(5).getCumulativePrincipal()));
            for (int i = 0; i < schedule.size(); i++) {
                assertEquals(i + 1, schedule.get(i).getMonth());
            }
        }

        @Test
        @DisplayName("Non-convergent repayment stops at the cap without paying off")
        void cappedWhenRepaymentNeverCoversInterest() {
            List<RepaymentStep> schedule = calculator.projectSchedule(money("5000"), money("30"), money("100"));

            assertEquals(AmortizationCalculator.DEFAULT_MAX_MONTHS, schedule.size());
            assertFalse(schedule.get(schedule.size() - 1).isPaidOff());
        }

        @Test
        @DisplayName("Custom cap is honoured")
        void customCap() {
            List<RepaymentStep> schedule = calculator.projectSchedule(money("5000"), money("19.9"), money("200"), 12);

            assertEquals(12, schedule.size());
        }

        @Test
        @DisplayName("Balances never go negative and cumulative totals never decrease")
        void monotonicTotals() {
            List<RepaymentStep> schedule = calculator.projectSchedule(money("5000"), money("19.9"), money("200"));

            assertEquals(33, schedule.size());
            BigDecimal previousInterest = BigDecimal.ZERO;
            BigDecimal previousPrincipal = BigDecimal.ZERO;
            for (RepaymentStep step : schedule) {
                assertTrue(step.getBalance().signum() >= 0);
                assertTrue(step.getCumulativeInterest().compareTo(previousInterest) >= 0);
                assertTrue(step.getCumulativePrincipal().compareTo(previousPrincipal) >= 0);
                previousInterest = step.getCumulativeInterest();
                previousPrincipal = step.getCumulativePrincipal();
            }
        }

        @Test
        @DisplayName("Nothing to repay or no repayment gives an empty schedule")
        void emptySchedules() {
            assertTrue(calculator.projectSchedule(BigDecimal.ZERO, money("5"), money("100")).isEmpty());
            assertTrue(calculator.projectSchedule(money("1000"), money("5"), BigDecimal.ZERO).isEmpty());
        }

        @Test
        @DisplayName("Projected schedule cannot be modified")
        void immutable() {
            List<RepaymentStep> schedule = calculator.projectSchedule(money("600"), BigDecimal.ZERO, money("100"));

            assertThrows(UnsupportedOperationException.class, () -> schedule.remove(0));
        }
    }
}
