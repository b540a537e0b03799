package com.flagship.wager_escrow.ledger;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves and locks ledger accounts.
 *
 * User accounts are created lazily the first time a user is touched.
 * Inserts use ON CONFLICT DO NOTHING and re-read, so two threads racing to
 * create the same account both end up with the same row.
 */
@Service
public class AccountService {

    private static final String SELECT_ACCOUNT =
        "SELECT id, account_number, account_type, owner_id, purpose FROM accounts ";

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public Account findOrCreateUserAccount(UUID ownerId, AccountPurpose purpose) {
        if (!purpose.isUserAccount()) {
            throw new IllegalArgumentException(purpose + " is not a per-user account");
        }
        return findUserAccount(ownerId, purpose).orElseGet(() -> {
            jdbcTemplate.update(
                "INSERT INTO accounts (id, account_number, account_type, owner_id, purpose, created_at) " +
                "VALUES (?, ?, ?, ?, ?, CURRENT_TIMESTAMP) ON CONFLICT DO NOTHING",
                UUID.randomUUID(),
                purpose.getNumberPrefix() + "-" + ownerId,
                purpose.getAccountType().name(),
                ownerId,
                purpose.name()
            );
            return findUserAccount(ownerId, purpose)
                .orElseThrow(() -> new IllegalStateException("Account creation failed for " + ownerId));
        });
    }

    @Transactional
    public Account findOrCreatePlatformAccount(AccountPurpose purpose) {
        if (purpose.isUserAccount()) {
            throw new IllegalArgumentException(purpose + " is a per-user account");
        }
        String accountNumber = purpose.getNumberPrefix();
        return findByNumber(accountNumber).orElseGet(() -> {
            jdbcTemplate.update(
                "INSERT INTO accounts (id, account_number, account_type, owner_id, purpose, created_at) " +
                "VALUES (?, ?, ?, NULL, ?, CURRENT_TIMESTAMP) ON CONFLICT DO NOTHING",
                UUID.randomUUID(),
                accountNumber,
                purpose.getAccountType().name(),
                purpose.name()
            );
            return findByNumber(accountNumber)
                .orElseThrow(() -> new IllegalStateException("Account creation failed for " + accountNumber));
        });
    }

    public Optional<Account> findUserAccount(UUID ownerId, AccountPurpose purpose) {
        List<Account> found = jdbcTemplate.query(
            SELECT_ACCOUNT + "WHERE owner_id = ? AND purpose = ?",
            accountRowMapper(),
            ownerId,
            purpose.name()
        );
        return found.stream().findFirst();
    }

    /**
     * Row-locks the account until the surrounding transaction ends.
     * Balance checks must happen after this call to be race-free.
     */
    @Transactional
    public void lock(UUID accountId) {
        List<UUID> locked = jdbcTemplate.queryForList(
            "SELECT id FROM accounts WHERE id = ? FOR UPDATE", UUID.class, accountId);
        if (locked.isEmpty()) {
            throw new IllegalArgumentException("Account not found: " + accountId);
        }
    }

    public Optional<Account> findPlatformAccount(AccountPurpose purpose) {
        if (purpose.isUserAccount()) {
            throw new IllegalArgumentException(purpose + " is a per-user account");
        }
        return findByNumber(purpose.getNumberPrefix());
    }

    private Optional<Account> findByNumber(String accountNumber) {
        List<Account> found = jdbcTemplate.query(
            SELECT_ACCOUNT + "WHERE account_number = ?",
            accountRowMapper(),
            accountNumber
        );
        return found.stream().findFirst();
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> {
            String owner = rs.getString("owner_id");
            return new Account(
                UUID.fromString(rs.getString("id")),
                rs.getString("account_number"),
                Account.AccountType.valueOf(rs.getString("account_type")),
                owner != null ? UUID.fromString(owner) : null,
                AccountPurpose.valueOf(rs.getString("purpose"))
            );
        };
    }
}
