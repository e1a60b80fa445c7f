package com.flagship.debt_ledger.api;

import com.flagship.debt_ledger.amortization.AmortizationCalculator;
import com.flagship.debt_ledger.amortization.RepaymentStep;
import com.flagship.debt_ledger.api.dto.PaymentQuoteResponse;
import com.flagship.debt_ledger.api.dto.ScheduleResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

/**
 * Stateless amortization quotes. Nothing here touches the repayment log.
 */
@RestController
@RequestMapping("/api/amortization")
@RequiredArgsConstructor
public class AmortizationController {

    private final AmortizationCalculator calculator;

    @GetMapping("/payment")
    public ResponseEntity<PaymentQuoteResponse> payment(
            @RequestParam("principal") BigDecimal principal,
            @RequestParam("annual_rate_percent") BigDecimal annualRatePercent,
            @RequestParam("total_months") int totalMonths) {

        requireNonNegative(principal, "principal");
        requireNonNegative(annualRatePercent, "annual_rate_percent");
        if (totalMonths < 1) {
            throw new IllegalArgumentException("total_months must be at least 1");
        }

        BigDecimal payment = calculator.amortizedPayment(principal, annualRatePercent, totalMonths);
        return ResponseEntity.ok(PaymentQuoteResponse.of(principal, annualRatePercent, totalMonths, payment));
    }

    @GetMapping("/schedule")
    public ResponseEntity<ScheduleResponse> schedule(
            @RequestParam("balance") BigDecimal balance,
            @RequestParam("annual_rate_percent") BigDecimal annualRatePercent,
            @RequestParam("monthly_repayment") BigDecimal monthlyRepayment,
            @RequestParam(value = "max_months", defaultValue = "" + AmortizationCalculator.DEFAULT_MAX_MONTHS)
            int maxMonths) {

        requireNonNegative(balance, "balance");
        requireNonNegative(annualRatePercent, "annual_rate_percent");
        requireNonNegative(monthlyRepayment, "monthly_repayment");
        if (maxMonths < 1 || maxMonths > AmortizationCalculator.DEFAULT_MAX_MONTHS) {
            throw new IllegalArgumentException(
                "max_months must be between 1 and " + AmortizationCalculator.DEFAULT_MAX_MONTHS);
        }

        List<RepaymentStep> steps = calculator.projectSchedule(balance, annualRatePercent, monthlyRepayment, maxMonths);
        return ResponseEntity.ok(ScheduleResponse.from(steps));
    }

    private void requireNonNegative(BigDecimal value, String name) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
    }
}
