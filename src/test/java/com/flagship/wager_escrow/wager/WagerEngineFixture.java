package com.flagship.wager_escrow.wager;

import com.flagship.wager_escrow.MutableClock;
import com.flagship.wager_escrow.config.WagerProperties;
import com.flagship.wager_escrow.escrow.EscrowLedger;
import com.flagship.wager_escrow.escrow.EscrowOperationEntity;
import com.flagship.wager_escrow.escrow.EscrowOperationKind;
import com.flagship.wager_escrow.escrow.EscrowOperationRepository;
import com.flagship.wager_escrow.escrow.RecordingWalletClient;
import com.flagship.wager_escrow.observability.WagerMetrics;
import com.flagship.wager_escrow.outbox.OutboxService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Wires a {@link WagerStateMachine} against in-memory collaborators: a map
 * backed store, a recording wallet, a journal kept in a map and a clock the
 * test moves by hand. The outbox is a Mockito mock so tests can verify events.
 */
public class WagerEngineFixture {

    public static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final InMemoryWagerStore store = new InMemoryWagerStore();
    public final RecordingWalletClient wallet = new RecordingWalletClient();
    public final WagerProperties properties = new WagerProperties();
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final WagerMetrics metrics = new WagerMetrics(registry);
    public final OutboxService outboxService = mock(OutboxService.class);
    public final EscrowOperationRepository operationRepository = mock(EscrowOperationRepository.class);
    public final EscrowLedger escrowLedger;
    public final ProofSettlementService proofSettlement = new ProofSettlementService();
    public final IdempotencyService idempotencyService;
    public final WagerStateMachine stateMachine;

    private final Map<String, EscrowOperationEntity> journal = new HashMap<>();

    public WagerEngineFixture() {
        when(operationRepository.findByWagerIdAndKind(any(UUID.class), any(EscrowOperationKind.class)))
                .thenAnswer(inv -> Optional.ofNullable(
                        journal.get(journalKey(inv.getArgument(0), inv.getArgument(1)))));
        when(operationRepository.save(any(EscrowOperationEntity.class)))
                .thenAnswer(inv -> {
                    EscrowOperationEntity entity = inv.getArgument(0);
                    journal.put(journalKey(entity.getWagerId(), entity.getKind()), entity);
                    return entity;
                });

        escrowLedger = new EscrowLedger(wallet, operationRepository, clock);
        idempotencyService = new IdempotencyService(store, Optional.empty(), metrics);
        stateMachine = new WagerStateMachine(store, escrowLedger, proofSettlement, idempotencyService,
                outboxService, metrics, properties, clock);
    }

    public boolean journaled(UUID wagerId, EscrowOperationKind kind) {
        return journal.containsKey(journalKey(wagerId, kind));
    }

    public NewWager.NewWagerBuilder newWager(UUID creatorId, long stake) {
        return NewWager.builder()
                .creatorId(creatorId)
                .stakeAmount(stake)
                .game("chess");
    }

    /**
     * Funds the creator and opens a wager with the given stake.
     */
    public Wager openWager(UUID creatorId, long stake) {
        wallet.fund(creatorId, stake);
        return stateMachine.create(newWager(creatorId, stake).build()).getWager();
    }

    /**
     * Opens, accepts and starts a wager.
     */
    public Wager inProgressWager(UUID creatorId, UUID acceptorId, long stake) {
        Wager wager = openWager(creatorId, stake);
        stateMachine.accept(wager.getId(), acceptorId);
        return stateMachine.start(wager.getId(), creatorId);
    }

    public Wager reload(UUID wagerId) {
        return store.findById(wagerId).orElseThrow();
    }

    private static String journalKey(UUID wagerId, EscrowOperationKind kind) {
        return wagerId + ":" + kind;
    }
}
