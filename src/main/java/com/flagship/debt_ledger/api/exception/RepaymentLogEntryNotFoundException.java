package com.flagship.debt_ledger.api.exception;

/**
 * Raised when a position has never been synced and so has no repayment log entry.
 */
public class RepaymentLogEntryNotFoundException extends RuntimeException {

    public RepaymentLogEntryNotFoundException(String positionId) {
        super("No repayment log entry for position: " + positionId);
    }
}
