package io.txretry.demo;

import java.math.BigDecimal;

import io.txretry.jdbc.util.Assert;

/**
 * One side of a transfer: a signed, non-zero balance change for an account.
 */
public final class AccountLeg {
    private final Long accountId;

    private final BigDecimal amount;

    private AccountLeg(Long accountId, BigDecimal amount) {
        Assert.notNull(accountId, "accountId is null");
        Assert.notNull(amount, "amount is null");
        Assert.isTrue(amount.signum() != 0, "amount is zero for account ID " + accountId);
        this.accountId = accountId;
        this.amount = amount;
    }

    public static AccountLeg debit(Long accountId, BigDecimal amount) {
        Assert.isTrue(amount != null && amount.signum() > 0, "debit amount must be positive");
        return new AccountLeg(accountId, amount.negate());
    }

    public static AccountLeg credit(Long accountId, BigDecimal amount) {
        Assert.isTrue(amount != null && amount.signum() > 0, "credit amount must be positive");
        return new AccountLeg(accountId, amount);
    }

    public Long getAccountId() {
        return accountId;
    }

    /**
     * @return the signed balance change, negative for a debit
     */
    public BigDecimal getAmount() {
        return amount;
    }

    public boolean isDebit() {
        return amount.signum() < 0;
    }

    @Override
    public String toString() {
        return (isDebit() ? "debit " : "credit ") + amount.abs().toPlainString() + " account " + accountId;
    }
}
