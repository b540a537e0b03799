package com.flagship.wager_escrow.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Posts balanced transactions to the double-entry ledger.
 *
 * Invariants:
 * 1. Debits equal credits (checked here, and again by a deferred trigger at commit)
 * 2. Entries are never updated or deleted
 * 3. Balances are derived from entries, never stored
 * 4. An idempotency key maps to at most one transaction
 */
@Service
public class LedgerService {

    private final JdbcTemplate jdbcTemplate;

    public LedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Posts a transaction, or returns the existing one for a repeated idempotency key.
     *
     * @return id of the (new or existing) ledger transaction
     * @throws IllegalArgumentException if the request is unbalanced or names an unknown account
     */
    @Transactional
    public UUID postTransaction(TransactionRequest request) {
        if (!request.isBalanced()) {
            throw new IllegalArgumentException(
                String.format("Transaction is not balanced: debits=%d, credits=%d",
                    request.getDebitTotal(), request.getCreditTotal()));
        }

        if (request.getIdempotencyKey() != null) {
            Optional<UUID> existing = findTransactionByIdempotencyKey(request.getIdempotencyKey());
            if (existing.isPresent()) {
                return existing.get();
            }
        }

        validateAccountsExist(request);

        UUID transactionId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO ledger_transactions (id, description, idempotency_key, created_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP)",
            transactionId,
            request.getDescription(),
            request.getIdempotencyKey()
        );

        for (TransactionRequest.DebitCredit debit : request.getDebits()) {
            createLedgerEntry(transactionId, debit, EntryType.DEBIT);
        }
        for (TransactionRequest.DebitCredit credit : request.getCredits()) {
            createLedgerEntry(transactionId, credit, EntryType.CREDIT);
        }

        return transactionId;
    }

    public Optional<UUID> findTransactionByIdempotencyKey(String idempotencyKey) {
        List<UUID> ids = jdbcTemplate.queryForList(
            "SELECT id FROM ledger_transactions WHERE idempotency_key = ?", UUID.class, idempotencyKey);
        return ids.stream().findFirst();
    }

    private void createLedgerEntry(UUID transactionId, TransactionRequest.DebitCredit line, EntryType entryType) {
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, transaction_id, account_id, amount, entry_type, description, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            UUID.randomUUID(),
            transactionId,
            line.getAccountId(),
            line.getAmount(),
            entryType.name(),
            line.getDescription()
        );
    }

    private void validateAccountsExist(TransactionRequest request) {
        List<UUID> accountIds = new ArrayList<>();
        request.getDebits().forEach(d -> accountIds.add(d.getAccountId()));
        request.getCredits().forEach(c -> accountIds.add(c.getAccountId()));

        for (UUID accountId : accountIds) {
            Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM accounts WHERE id = ?", Integer.class, accountId);
            if (count == null || count == 0) {
                throw new IllegalArgumentException("Account not found: " + accountId);
            }
        }
    }

    /**
     * Derived balance: ASSET grows with debits, LIABILITY and EQUITY with credits.
     */
    public long getAccountBalance(UUID accountId) {
        List<String> types = jdbcTemplate.queryForList(
            "SELECT account_type FROM accounts WHERE id = ?", String.class, accountId);
        if (types.isEmpty()) {
            throw new IllegalArgumentException("Account not found: " + accountId);
        }
        String accountType = types.get(0);

        Long balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE " +
            "  WHEN ? = 'ASSET' THEN CASE WHEN entry_type = 'DEBIT' THEN amount ELSE -amount END " +
            "  ELSE CASE WHEN entry_type = 'CREDIT' THEN amount ELSE -amount END " +
            "  END), 0) " +
            "FROM ledger_entries WHERE account_id = ?",
            Long.class,
            accountType,
            accountId
        );
        return balance != null ? balance : 0L;
    }

    public List<LedgerEntry> getLedgerEntriesForTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT id, transaction_id, account_id, amount, entry_type, description, sequence_number " +
            "FROM ledger_entries WHERE transaction_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            transactionId
        );
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("transaction_id")),
            UUID.fromString(rs.getString("account_id")),
            rs.getLong("amount"),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getString("description"),
            rs.getLong("sequence_number")
        );
    }
}
