package com.flagship.wager_escrow.ledger;

import com.flagship.wager_escrow.escrow.InsufficientFundsException;
import com.flagship.wager_escrow.escrow.WalletClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * In-process wallet service on top of the double-entry ledger.
 *
 * Account layout:
 * <pre>
 *   deposit : FUNDING (debit)        -> user AVAILABLE (credit)
 *   hold    : user AVAILABLE (debit) -> user ESCROW (credit)
 *   release : creator ESCROW (debit) -> winner AVAILABLE (credit)
 *   collect : creator ESCROW (debit) -> PLATFORM_FEE (credit)
 *   refund  : user ESCROW (debit)    -> user AVAILABLE (credit)
 * </pre>
 * Every call posts one ledger transaction under the caller's idempotency key,
 * so a replayed key returns the original transaction id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerWalletClient implements WalletClient {

    private final LedgerService ledgerService;
    private final AccountService accountService;

    @Override
    @Transactional
    public UUID hold(UUID userId, long amount, String idempotencyKey) {
        var replay = ledgerService.findTransactionByIdempotencyKey(idempotencyKey);
        if (replay.isPresent()) {
            return replay.get();
        }

        Account available = accountService.findOrCreateUserAccount(userId, AccountPurpose.AVAILABLE);
        Account escrow = accountService.findOrCreateUserAccount(userId, AccountPurpose.ESCROW);

        accountService.lock(available.getId());
        long balance = ledgerService.getAccountBalance(available.getId());
        if (balance < amount) {
            throw new InsufficientFundsException(userId, balance, amount);
        }

        return post("Escrow hold", idempotencyKey, available, escrow, amount);
    }

    @Override
    @Transactional
    public UUID release(UUID fromUserId, UUID toUserId, long amount, String idempotencyKey) {
        Account escrow = accountService.findOrCreateUserAccount(fromUserId, AccountPurpose.ESCROW);
        Account winner = accountService.findOrCreateUserAccount(toUserId, AccountPurpose.AVAILABLE);
        return post("Escrow release", idempotencyKey, escrow, winner, amount);
    }

    @Override
    @Transactional
    public UUID collect(UUID fromUserId, long amount, String idempotencyKey) {
        Account escrow = accountService.findOrCreateUserAccount(fromUserId, AccountPurpose.ESCROW);
        Account fees = accountService.findOrCreatePlatformAccount(AccountPurpose.PLATFORM_FEE);
        return post("Platform fee", idempotencyKey, escrow, fees, amount);
    }

    @Override
    @Transactional
    public UUID refund(UUID userId, long amount, String idempotencyKey) {
        Account escrow = accountService.findOrCreateUserAccount(userId, AccountPurpose.ESCROW);
        Account available = accountService.findOrCreateUserAccount(userId, AccountPurpose.AVAILABLE);
        return post("Escrow refund", idempotencyKey, escrow, available, amount);
    }

    /**
     * Credits a user's available balance from the platform funding account.
     */
    @Transactional
    public UUID deposit(UUID userId, long amount, String idempotencyKey) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Deposit amount must be positive");
        }
        Account funding = accountService.findOrCreatePlatformAccount(AccountPurpose.FUNDING);
        Account available = accountService.findOrCreateUserAccount(userId, AccountPurpose.AVAILABLE);
        return post("Deposit", idempotencyKey, funding, available, amount);
    }

    @Transactional(readOnly = true)
    public WalletBalance balanceOf(UUID userId) {
        long available = accountService.findUserAccount(userId, AccountPurpose.AVAILABLE)
                .map(a -> ledgerService.getAccountBalance(a.getId()))
                .orElse(0L);
        long escrow = accountService.findUserAccount(userId, AccountPurpose.ESCROW)
                .map(a -> ledgerService.getAccountBalance(a.getId()))
                .orElse(0L);
        return new WalletBalance(userId, available, escrow);
    }

    @Transactional(readOnly = true)
    public long platformFeeBalance() {
        return accountService.findPlatformAccount(AccountPurpose.PLATFORM_FEE)
                .map(a -> ledgerService.getAccountBalance(a.getId()))
                .orElse(0L);
    }

    private UUID post(String description, String idempotencyKey, Account debit, Account credit, long amount) {
        UUID transactionId = ledgerService.postTransaction(
                TransactionRequest.transfer(description, idempotencyKey, debit.getId(), credit.getId(), amount));
        log.debug("{} posted: ledgerTxId={}, debit={}, credit={}, amount={}",
                description, transactionId, debit.getAccountNumber(), credit.getAccountNumber(), amount);
        return transactionId;
    }
}
