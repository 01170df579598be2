package com.dinoventures.ledger.exception;

/**
 * Raised when a savings transaction would exceed the daily or monthly cap.
 */
public class TransactionLimitException extends LedgerException {

    public enum LimitType {
        DAILY("day"),
        MONTHLY("month");

        private final String period;

        LimitType(String period) {
            this.period = period;
        }

        public String getPeriod() {
            return period;
        }
    }

    private final LimitType limitType;
    private final int limit;

    public TransactionLimitException(LimitType limitType, int limit) {
        super(String.format(
            "This transaction could not be completed because this account already has %d transactions in this %s.",
            limit, limitType.getPeriod()
        ));
        this.limitType = limitType;
        this.limit = limit;
    }

    public LimitType getLimitType() {
        return limitType;
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public String getCode() {
        return "TRANSACTION_LIMIT";
    }
}
