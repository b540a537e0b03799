package com.flagship.wager_escrow.ledger;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Balance lookup and funding for the in-process wallet.
 */
@RestController
@RequestMapping("/api/wallets")
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    private final LedgerWalletClient walletClient;

    @GetMapping("/{userId}")
    public ResponseEntity<WalletBalance> getBalance(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(walletClient.balanceOf(userId));
    }

    /**
     * Deposits are keyed by the Idempotency-Key header; a replay does not credit twice.
     */
    @PostMapping("/{userId}/deposits")
    public ResponseEntity<WalletBalance> deposit(@PathVariable("userId") UUID userId,
                                                 @Valid @RequestBody DepositRequest request,
                                                 @RequestHeader("Idempotency-Key") String idempotencyKey) {
        log.info("Deposit request: userId={}, amount={}", userId, request.getAmount());
        walletClient.deposit(userId, request.getAmount(), "deposit:" + idempotencyKey);
        return ResponseEntity.ok(walletClient.balanceOf(userId));
    }

    @Value
    public static class DepositRequest {
        @Min(value = 1, message = "Amount must be positive")
        long amount;
    }
}
