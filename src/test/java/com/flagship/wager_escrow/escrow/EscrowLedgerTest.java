package com.flagship.wager_escrow.escrow;

import com.flagship.wager_escrow.MutableClock;
import com.flagship.wager_escrow.wager.exception.EscrowHoldFailedException;
import com.flagship.wager_escrow.wager.exception.EscrowUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EscrowLedgerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private EscrowOperationRepository operationRepository;

    private RecordingWalletClient wallet;
    private EscrowLedger escrowLedger;
    private UUID wagerId;
    private UUID creator;
    private UUID acceptor;

    @BeforeEach
    void setUp() {
        wallet = new RecordingWalletClient();
        escrowLedger = new EscrowLedger(wallet, operationRepository, new MutableClock(NOW));
        wagerId = UUID.randomUUID();
        creator = UUID.randomUUID();
        acceptor = UUID.randomUUID();
    }

    @Test
    @DisplayName("Hold calls the wallet with a per-wager key and journals the result")
    void holdJournalsOperation() {
        wallet.fund(creator, 1000);
        when(operationRepository.findByWagerIdAndKind(wagerId, EscrowOperationKind.HOLD))
                .thenReturn(Optional.empty());

        EscrowOperation operation = escrowLedger.hold(wagerId, creator, 1000);

        assertEquals(EscrowOperationKind.HOLD, operation.getKind());
        assertEquals("wager:" + wagerId + ":hold", operation.getIdempotencyKey());
        assertEquals(NOW, operation.getCreatedAt());
        assertNotNull(operation.getWalletReference());
        assertEquals(1000, wallet.escrowOf(creator));

        ArgumentCaptor<EscrowOperationEntity> saved = ArgumentCaptor.forClass(EscrowOperationEntity.class);
        verify(operationRepository).save(saved.capture());
        assertEquals(operation, saved.getValue().toDomain());
    }

    @Test
    @DisplayName("Journaled operation is returned without calling the wallet again")
    void journaledOperationIsNotRepeated() {
        wallet.fund(creator, 1000);
        when(operationRepository.findByWagerIdAndKind(wagerId, EscrowOperationKind.HOLD))
                .thenReturn(Optional.empty());
        EscrowOperation first = escrowLedger.hold(wagerId, creator, 1000);

        when(operationRepository.findByWagerIdAndKind(wagerId, EscrowOperationKind.HOLD))
                .thenReturn(Optional.of(EscrowOperationEntity.fromDomain(first)));
        EscrowOperation second = escrowLedger.hold(wagerId, creator, 1000);

        assertEquals(first, second);
        assertEquals(1, wallet.calls().size());
        assertEquals(1000, wallet.escrowOf(creator));
    }

    @Test
    @DisplayName("Release moves escrow to the winner's available balance")
    void releasePaysWinner() {
        wallet.fund(creator, 1000);
        wallet.hold(creator, 1000, "setup");
        when(operationRepository.findByWagerIdAndKind(wagerId, EscrowOperationKind.RELEASE))
                .thenReturn(Optional.empty());

        EscrowOperation operation = escrowLedger.release(wagerId, creator, acceptor, 950);

        assertEquals(acceptor, operation.getToUserId());
        assertEquals(950, wallet.availableOf(acceptor));
        assertEquals(50, wallet.escrowOf(creator));
    }

    @Test
    @DisplayName("Insufficient funds become a hold failure")
    void insufficientFunds() {
        wallet.fund(creator, 10);
        when(operationRepository.findByWagerIdAndKind(wagerId, EscrowOperationKind.HOLD))
                .thenReturn(Optional.empty());

        EscrowHoldFailedException e = assertThrows(EscrowHoldFailedException.class,
                () -> escrowLedger.hold(wagerId, creator, 1000));

        assertInstanceOf(InsufficientFundsException.class, e.getCause());
        verify(operationRepository, never()).save(any());
    }

    @Test
    @DisplayName("Other wallet failures become a retryable unavailability")
    void walletFailure() {
        wallet.failWith(new IllegalStateException("socket closed"));
        when(operationRepository.findByWagerIdAndKind(wagerId, EscrowOperationKind.REFUND))
                .thenReturn(Optional.empty());

        EscrowUnavailableException e = assertThrows(EscrowUnavailableException.class,
                () -> escrowLedger.refund(wagerId, creator, 1000));

        assertTrue(e.isRetryable());
        verify(operationRepository, never()).save(any());
    }
}
