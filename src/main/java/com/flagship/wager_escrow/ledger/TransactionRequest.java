package com.flagship.wager_escrow.ledger;

import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A balanced set of debits and credits to post atomically.
 *
 * Invariant: sum of debits equals sum of credits.
 * idempotencyKey is optional; when present, posting the same key twice
 * returns the first transaction instead of creating a second one.
 */
@Value
public class TransactionRequest {
    String description;
    String idempotencyKey;
    List<DebitCredit> debits;
    List<DebitCredit> credits;

    /**
     * A single transfer from one account to another.
     */
    public static TransactionRequest transfer(String description, String idempotencyKey,
                                              UUID debitAccountId, UUID creditAccountId, long amount) {
        return new TransactionRequest(
            description,
            idempotencyKey,
            List.of(DebitCredit.of(debitAccountId, amount, description)),
            List.of(DebitCredit.of(creditAccountId, amount, description))
        );
    }

    public boolean isBalanced() {
        return getDebitTotal() == getCreditTotal();
    }

    public long getDebitTotal() {
        return debits.stream().mapToLong(DebitCredit::getAmount).sum();
    }

    public long getCreditTotal() {
        return credits.stream().mapToLong(DebitCredit::getAmount).sum();
    }

    @Value
    public static class DebitCredit {
        UUID accountId;
        long amount;
        String description;

        private DebitCredit(UUID accountId, long amount, String description) {
            this.accountId = Objects.requireNonNull(accountId);
            if (amount <= 0) {
                throw new IllegalArgumentException("Amount must be positive");
            }
            this.amount = amount;
            this.description = description;
        }

        public static DebitCredit of(UUID accountId, long amount, String description) {
            return new DebitCredit(accountId, amount, description);
        }
    }
}
