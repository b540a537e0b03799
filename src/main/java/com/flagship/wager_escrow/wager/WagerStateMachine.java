package com.flagship.wager_escrow.wager;

import com.flagship.wager_escrow.config.WagerProperties;
import com.flagship.wager_escrow.escrow.EscrowLedger;
import com.flagship.wager_escrow.observability.CorrelationContext;
import com.flagship.wager_escrow.observability.WagerMetrics;
import com.flagship.wager_escrow.outbox.OutboxService;
import com.flagship.wager_escrow.wager.event.DisputeOpenedEvent;
import com.flagship.wager_escrow.wager.event.ProofSubmittedEvent;
import com.flagship.wager_escrow.wager.event.WagerAcceptedEvent;
import com.flagship.wager_escrow.wager.event.WagerClosedEvent;
import com.flagship.wager_escrow.wager.event.WagerCreatedEvent;
import com.flagship.wager_escrow.wager.event.WagerEvent;
import com.flagship.wager_escrow.wager.event.WagerSettledEvent;
import com.flagship.wager_escrow.wager.exception.DeadlinePassedException;
import com.flagship.wager_escrow.wager.exception.DisputeWindowClosedException;
import com.flagship.wager_escrow.wager.exception.StateConflictException;
import com.flagship.wager_escrow.wager.exception.WagerException;
import com.flagship.wager_escrow.wager.exception.WagerExpiredException;
import com.flagship.wager_escrow.wager.exception.WagerNotFoundException;
import com.flagship.wager_escrow.wager.exception.WagerPermissionException;
import com.flagship.wager_escrow.wager.exception.WagerValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Owns every wager transition and the escrow movement that goes with it.
 *
 * Each public operation runs in one transaction:
 * <ol>
 *   <li>validate the arguments (no side effects yet)</li>
 *   <li>lock the wager row and re-check its state</li>
 *   <li>apply escrow effects, write the new state, write the outbox event</li>
 * </ol>
 * An escrow failure rolls everything back. The exception is a
 * {@link DeadlinePassedException}: when a request finds a wager past one of its
 * deadlines the timeout transition is applied on the spot, committed, and the
 * request then fails with the deadline exception.
 *
 * Only the creator's stake is escrowed. Settlement pays the winner out of it
 * and the platform keeps the fee.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WagerStateMachine {

    private static final String AGGREGATE_TYPE = "Wager";
    private static final int MAX_GAME_LENGTH = 100;
    private static final int MAX_TITLE_LENGTH = 200;
    private static final int MAX_TEXT_LENGTH = 2000;
    private static final int MAX_URL_LENGTH = 500;

    private final WagerStore store;
    private final EscrowLedger escrowLedger;
    private final ProofSettlementService proofSettlement;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final WagerMetrics metrics;
    private final WagerProperties properties;
    private final Clock clock;

    /**
     * Opens a wager and holds the creator's stake.
     *
     * A repeated Idempotency-Key returns the wager it created the first time,
     * without a second hold. Keys belong to the creator who first used them.
     *
     * @throws WagerValidationException INVALID_STAKE, SELF_CHALLENGE, RATE_LIMITED, INVALID_REQUEST,
     *         IDEMPOTENCY_KEY_CONFLICT
     * @throws com.flagship.wager_escrow.wager.exception.EscrowHoldFailedException if the creator cannot cover the stake
     */
    @Transactional
    public CreatedWager create(NewWager request) {
        validateNewWager(request);

        String key = request.getIdempotencyKey();
        if (key != null) {
            Optional<Wager> existing = idempotencyService.findWagerId(key).flatMap(store::findById);
            if (existing.isPresent() && !existing.get().getCreatorId().equals(request.getCreatorId())) {
                metrics.recordRejected("create", WagerValidationException.IDEMPOTENCY_KEY_CONFLICT);
                throw new WagerValidationException(WagerValidationException.IDEMPOTENCY_KEY_CONFLICT,
                        "Idempotency key was already used by another creator");
            }
            if (existing.isPresent()) {
                log.info("Idempotency key already used, returning existing wager: wagerId={}",
                        existing.get().getId());
                metrics.recordCreated("replayed");
                return new CreatedWager(existing.get(), true);
            }
        }

        UUID wagerId = UUID.randomUUID();
        return run("create", wagerId, () -> {
            Instant now = Instant.now(clock);
            UUID creator = request.getCreatorId();

            long recent = store.countCreatedSince(creator, now.minus(properties.getLimits().getCreationWindow()));
            if (recent >= properties.getLimits().getMaxCreatedPerWindow()) {
                throw new WagerValidationException(WagerValidationException.RATE_LIMITED,
                        String.format("Creator %s already opened %d wagers in the last %s",
                                creator, recent, properties.getLimits().getCreationWindow()));
            }

            Wager wager = Wager.open(wagerId, creator, request.getStakeAmount(), request.getGame().trim(),
                    request.getTargetUserId(), trimToNull(request.getTitle()), trimToNull(request.getDescription()),
                    now, properties.getAcceptanceWindow());

            Wager saved = store.insert(wager, key);
            escrowLedger.hold(wagerId, creator, wager.getStakeAmount());
            metrics.recordEscrowOperation("hold");
            publish(WagerCreatedEvent.fromWager(saved));

            if (key != null) {
                idempotencyService.remember(key, wagerId);
            }
            metrics.recordCreated("success");
            log.info("Wager created: creator={}, stake={}, game={}, expiresAt={}",
                    creator, saved.getStakeAmount(), saved.getGame(), saved.getExpiresAt());
            return new CreatedWager(saved, false);
        });
    }

    /**
     * Records the acceptor. Accepting again as the same acceptor returns the
     * existing acceptance.
     *
     * @throws WagerExpiredException if the acceptance window has closed (the wager is expired first)
     * @throws StateConflictException ALREADY_ACCEPTED for a different acceptor
     */
    @Transactional(noRollbackFor = DeadlinePassedException.class)
    public Acceptance accept(UUID wagerId, UUID acceptorId) {
        requireId(acceptorId, "acceptor");
        return run("accept", wagerId, () -> {
            Instant now = Instant.now(clock);
            Wager wager = store.lockById(wagerId);

            expireIfStale(wager, now);

            if (wager.getStatus() != WagerStatus.OPEN) {
                Optional<Acceptance> existing = store.findAcceptance(wagerId);
                if (existing.isPresent() && existing.get().getAcceptorId().equals(acceptorId)) {
                    log.info("Wager already accepted by {}, returning existing acceptance", acceptorId);
                    return existing.get();
                }
                if (existing.isPresent()) {
                    throw new StateConflictException(StateConflictException.ALREADY_ACCEPTED, wager.getStatus(),
                            "Wager " + wagerId + " was already accepted by another user");
                }
                if (wager.getStatus() == WagerStatus.EXPIRED) {
                    throw new WagerExpiredException(wagerId);
                }
                throw StateConflictException.illegalTransition(wager.getStatus(), WagerStatus.ACCEPTED);
            }

            if (acceptorId.equals(wager.getCreatorId())) {
                throw new WagerValidationException(WagerValidationException.SELF_CHALLENGE,
                        "Creator cannot accept their own wager");
            }
            if (wager.getTargetUserId() != null && !wager.getTargetUserId().equals(acceptorId)) {
                throw new WagerValidationException(WagerValidationException.NOT_TARGET_USER,
                        "Wager " + wagerId + " is reserved for another user");
            }
            long openAcceptances = store.countOpenAcceptances(acceptorId);
            if (openAcceptances >= properties.getLimits().getMaxOpenAcceptances()) {
                throw new WagerValidationException(WagerValidationException.TOO_MANY_ACTIVE,
                        String.format("User %s already has %d active accepted wagers", acceptorId, openAcceptances));
            }

            Acceptance acceptance = store.insertAcceptance(new Acceptance(wagerId, acceptorId, now));
            Wager accepted = transition(wager, wager.accept(acceptorId, now));
            publish(WagerAcceptedEvent.fromWager(accepted));

            log.info("Wager accepted: acceptor={}", acceptorId);
            return acceptance;
        });
    }

    /**
     * ACCEPTED to IN_PROGRESS. Either participant may start the match.
     *
     * @throws WagerExpiredException if the wager was still OPEN past its deadline (the wager is expired first)
     */
    @Transactional(noRollbackFor = DeadlinePassedException.class)
    public Wager start(UUID wagerId, UUID actorId) {
        requireId(actorId, "actor");
        return run("start", wagerId, () -> {
            Instant now = Instant.now(clock);
            Wager wager = store.lockById(wagerId);

            expireIfStale(wager, now);
            requireParticipant(wager, actorId);

            Wager started = transition(wager, wager.start(now));
            log.info("Wager started by {}", actorId);
            return started;
        });
    }

    /**
     * Records a participant's claim about the winner.
     *
     * The first proof opens the dispute window. A second, agreeing proof
     * settles the wager at once; a conflicting one leaves it in PENDING_RESULT.
     *
     * @throws DisputeWindowClosedException if the window had lapsed (the first claim is settled first)
     * @throws StateConflictException PROOF_ALREADY_SUBMITTED when the submitter changes their claim
     */
    @Transactional(noRollbackFor = DeadlinePassedException.class)
    public Proof submitProof(UUID wagerId, UUID submitterId, UUID claimedWinnerId,
                             String evidenceUrl, EvidenceType evidenceType) {
        requireId(submitterId, "submitter");
        validateProof(claimedWinnerId, evidenceUrl, evidenceType);
        return run("submit_proof", wagerId, () -> {
            Instant now = Instant.now(clock);
            Wager wager = store.lockById(wagerId);

            expireIfStale(wager, now);
            settleIfLapsed(wager, now);
            requireParticipant(wager, submitterId);
            if (!wager.isParticipant(claimedWinnerId)) {
                throw new WagerValidationException(WagerValidationException.MALFORMED_PROOF,
                        "Claimed winner " + claimedWinnerId + " is not a participant");
            }

            List<Proof> proofs = store.findProofs(wagerId);
            Optional<Proof> own = proofs.stream()
                    .filter(p -> p.getSubmitterId().equals(submitterId))
                    .findFirst();
            if (own.isPresent()) {
                if (own.get().getClaimedWinnerId().equals(claimedWinnerId)) {
                    log.info("Duplicate proof from {} ignored", submitterId);
                    return own.get();
                }
                throw new StateConflictException(StateConflictException.PROOF_ALREADY_SUBMITTED, wager.getStatus(),
                        "Submitter " + submitterId + " already claimed a different winner");
            }

            if (wager.getStatus() != WagerStatus.IN_PROGRESS && wager.getStatus() != WagerStatus.PENDING_RESULT) {
                throw StateConflictException.illegalTransition(wager.getStatus(), WagerStatus.PENDING_RESULT);
            }

            Proof proof = store.appendProof(
                    Proof.submit(wagerId, submitterId, claimedWinnerId, evidenceUrl.trim(), evidenceType, now));

            if (wager.getStatus() == WagerStatus.IN_PROGRESS) {
                Wager pending = transition(wager, wager.markResultSubmitted(now));
                publish(ProofSubmittedEvent.fromProof(proof, true,
                        pending.disputeDeadline(properties.getDisputeWindow())));
                log.info("First proof submitted by {}, claimed winner {}", submitterId, claimedWinnerId);
                return proof;
            }

            publish(ProofSubmittedEvent.fromProof(proof, false, wager.disputeDeadline(properties.getDisputeWindow())));
            List<Proof> all = store.findProofs(wagerId);
            ProofConsensus consensus = proofSettlement.evaluate(all);
            if (consensus.isAgreed()) {
                settle(wager, consensus.getWinnerId(), SettlementTrigger.AGREED_PROOFS, now);
            } else {
                log.info("Second proof from {} conflicts with the first claim; awaiting dispute or window lapse",
                        submitterId);
            }
            return proof;
        });
    }

    /**
     * Contests the first claim. Only the participant who did not submit it may
     * dispute, and only while the window is open.
     *
     * @throws DisputeWindowClosedException if the window had lapsed (the first claim is settled first)
     */
    @Transactional(noRollbackFor = DeadlinePassedException.class)
    public Dispute openDispute(UUID wagerId, UUID disputerId, String reason) {
        requireId(disputerId, "disputer");
        int minLength = properties.getDispute().getMinReasonLength();
        if (reason == null || reason.trim().length() < minLength) {
            throw new WagerValidationException(WagerValidationException.REASON_TOO_SHORT,
                    "Dispute reason must be at least " + minLength + " characters");
        }
        if (reason.length() > MAX_TEXT_LENGTH) {
            throw new WagerValidationException(WagerValidationException.INVALID_REQUEST,
                    "Dispute reason must be at most " + MAX_TEXT_LENGTH + " characters");
        }
        return run("open_dispute", wagerId, () -> {
            Instant now = Instant.now(clock);
            Wager wager = store.lockById(wagerId);

            expireIfStale(wager, now);
            settleIfLapsed(wager, now);
            if (wager.getStatus() != WagerStatus.PENDING_RESULT) {
                throw StateConflictException.illegalTransition(wager.getStatus(), WagerStatus.DISPUTED);
            }
            requireParticipant(wager, disputerId);

            Proof contested = contestedProof(wager);
            if (contested.getSubmitterId().equals(disputerId)) {
                throw new WagerPermissionException(WagerPermissionException.NOT_DISPUTER,
                        "The submitter of the contested proof cannot dispute it");
            }

            Dispute dispute = store.insertDispute(Dispute.open(wagerId, disputerId, reason.trim(), now));
            transition(wager, wager.dispute());
            publish(DisputeOpenedEvent.fromDispute(dispute, contested.getClaimedWinnerId()));

            log.info("Dispute {} opened by {}", dispute.getId(), disputerId);
            return dispute;
        });
    }

    /**
     * Applies a moderator's decision and settles the wager.
     *
     * CONFIRM_ORIGINAL pays the first proof's claimed winner, REVERSE pays the
     * other participant and VOID returns the whole stake to the creator.
     *
     * @throws WagerPermissionException NOT_ASSIGNED_MODERATOR if another moderator owns the dispute
     */
    @Transactional(noRollbackFor = DeadlinePassedException.class)
    public Dispute resolveDispute(UUID disputeId, UUID moderatorId, DisputeResolution outcome, String notes) {
        requireId(moderatorId, "moderator");
        if (outcome == null) {
            throw new WagerValidationException(WagerValidationException.INVALID_REQUEST, "Resolution is required");
        }
        if (notes != null && notes.length() > MAX_TEXT_LENGTH) {
            throw new WagerValidationException(WagerValidationException.INVALID_REQUEST,
                    "Moderator notes must be at most " + MAX_TEXT_LENGTH + " characters");
        }
        UUID wagerId = store.findDispute(disputeId)
                .orElseThrow(() -> WagerNotFoundException.dispute(disputeId))
                .getWagerId();

        return run("resolve_dispute", wagerId, () -> {
            Instant now = Instant.now(clock);
            Wager wager = store.lockById(wagerId);
            Dispute dispute = store.findDispute(disputeId)
                    .orElseThrow(() -> WagerNotFoundException.dispute(disputeId));

            if (dispute.isResolved()) {
                throw new StateConflictException(StateConflictException.DISPUTE_ALREADY_RESOLVED,
                        wager.getStatus(), "Dispute " + disputeId + " was already resolved");
            }
            if (wager.getStatus() != WagerStatus.DISPUTED) {
                throw StateConflictException.illegalTransition(wager.getStatus(), WagerStatus.COMPLETED);
            }
            if (dispute.getAssignedModeratorId() != null && !dispute.getAssignedModeratorId().equals(moderatorId)) {
                throw new WagerPermissionException(WagerPermissionException.NOT_ASSIGNED_MODERATOR,
                        "Dispute " + disputeId + " is assigned to another moderator");
            }

            Proof contested = contestedProof(wager);
            Dispute resolved = store.updateDispute(
                    dispute.resolve(outcome, moderatorId, trimToNull(notes), now, wager.getStatus()));
            settle(wager, proofSettlement.winnerFor(outcome, wager, contested),
                    SettlementTrigger.DISPUTE_RESOLUTION, now);

            log.info("Dispute {} resolved by {} as {}", disputeId, moderatorId, outcome);
            return resolved;
        });
    }

    /**
     * Settles an undisputed wager whose dispute window lapsed, in favor of the
     * first proof's claim. Returns the recorded result if it is already COMPLETED.
     */
    @Transactional(noRollbackFor = DeadlinePassedException.class)
    public Wager finalizeLapsedResult(UUID wagerId) {
        return run("finalize", wagerId, () -> {
            Instant now = Instant.now(clock);
            Wager wager = store.lockById(wagerId);

            if (wager.getStatus() == WagerStatus.COMPLETED) {
                log.info("Wager already completed, nothing to finalize");
                return wager;
            }
            if (wager.getStatus() != WagerStatus.PENDING_RESULT) {
                throw StateConflictException.illegalTransition(wager.getStatus(), WagerStatus.COMPLETED);
            }
            if (!wager.hasLapsedResultWindowAt(now, properties.getDisputeWindow())) {
                throw new StateConflictException(StateConflictException.DEADLINE_NOT_REACHED, wager.getStatus(),
                        "Dispute window of wager " + wagerId + " is still open until "
                                + wager.disputeDeadline(properties.getDisputeWindow()));
            }
            return settleLapsed(wager, now);
        });
    }

    /**
     * Withdraws an OPEN wager and refunds the creator.
     *
     * @throws WagerPermissionException NOT_CREATOR
     * @throws WagerExpiredException if the acceptance window has already closed (the wager is expired first)
     */
    @Transactional(noRollbackFor = DeadlinePassedException.class)
    public Wager cancel(UUID wagerId, UUID actorId) {
        requireId(actorId, "actor");
        return run("cancel", wagerId, () -> {
            Instant now = Instant.now(clock);
            Wager wager = store.lockById(wagerId);

            expireIfStale(wager, now);
            if (!actorId.equals(wager.getCreatorId())) {
                throw new WagerPermissionException(WagerPermissionException.NOT_CREATOR,
                        "Only the creator can cancel wager " + wagerId);
            }

            Wager cancelled = wager.cancel(now);
            escrowLedger.refund(wagerId, wager.getCreatorId(), wager.getStakeAmount());
            metrics.recordEscrowOperation("refund");
            cancelled = transition(wager, cancelled);
            publish(WagerClosedEvent.fromWager(cancelled));

            log.info("Wager cancelled, refunded {} to creator", wager.getStakeAmount());
            return cancelled;
        });
    }

    /**
     * Expires an OPEN wager past its acceptance deadline and refunds the
     * creator. Returns an already EXPIRED wager unchanged.
     */
    @Transactional(noRollbackFor = DeadlinePassedException.class)
    public Wager expire(UUID wagerId) {
        return run("expire", wagerId, () -> {
            Instant now = Instant.now(clock);
            Wager wager = store.lockById(wagerId);

            if (wager.getStatus() == WagerStatus.EXPIRED) {
                return wager;
            }
            if (wager.getStatus() != WagerStatus.OPEN) {
                throw StateConflictException.illegalTransition(wager.getStatus(), WagerStatus.EXPIRED);
            }
            if (!wager.isExpiredAt(now)) {
                throw new StateConflictException(StateConflictException.DEADLINE_NOT_REACHED, wager.getStatus(),
                        "Wager " + wagerId + " is open for acceptance until " + wager.getExpiresAt());
            }
            return applyExpiry(wager, now);
        });
    }

    private void expireIfStale(Wager wager, Instant now) {
        if (wager.isExpiredAt(now)) {
            applyExpiry(wager, now);
            throw new WagerExpiredException(wager.getId());
        }
    }

    private Wager applyExpiry(Wager wager, Instant now) {
        Wager expired = wager.expire(now);
        escrowLedger.refund(wager.getId(), wager.getCreatorId(), wager.getStakeAmount());
        metrics.recordEscrowOperation("refund");
        expired = transition(wager, expired);
        publish(WagerClosedEvent.fromWager(expired));

        log.info("Wager expired unaccepted at {}, refunded {} to creator", wager.getExpiresAt(), wager.getStakeAmount());
        return expired;
    }

    private void settleIfLapsed(Wager wager, Instant now) {
        if (wager.hasLapsedResultWindowAt(now, properties.getDisputeWindow())) {
            settleLapsed(wager, now);
            throw new DisputeWindowClosedException(wager.getId(), WagerStatus.COMPLETED);
        }
    }

    private Wager settleLapsed(Wager wager, Instant now) {
        Proof contested = contestedProof(wager);
        log.info("Dispute window lapsed, first claim stands: winner={}", contested.getClaimedWinnerId());
        return settle(wager, contested.getClaimedWinnerId(), SettlementTrigger.LAPSED_WINDOW, now);
    }

    /**
     * Moves the escrowed stake and completes the wager. A null winner is a void
     * and refunds the creator in full. No-op for a COMPLETED wager.
     */
    private Wager settle(Wager wager, UUID winnerId, SettlementTrigger trigger, Instant now) {
        if (wager.getStatus() == WagerStatus.COMPLETED) {
            log.info("Wager already settled as {}, escrow untouched", wager.getSettlementOutcome());
            return wager;
        }

        Wager completed;
        if (winnerId == null) {
            completed = wager.completeVoid(now);
            escrowLedger.refund(wager.getId(), wager.getCreatorId(), wager.getStakeAmount());
            metrics.recordEscrowOperation("refund");
        } else {
            SettlementSplit split = SettlementSplit.of(wager.getStakeAmount(), properties.getPlatformFeeBasisPoints());
            completed = wager.completeWithWinner(winnerId, split.getPayout(), split.getFee(), now);
            escrowLedger.release(wager.getId(), wager.getCreatorId(), winnerId, split.getPayout());
            metrics.recordEscrowOperation("release");
            if (split.getFee() > 0) {
                escrowLedger.collect(wager.getId(), wager.getCreatorId(), split.getFee());
                metrics.recordEscrowOperation("collect");
            }
        }

        completed = transition(wager, completed);
        publish(WagerSettledEvent.fromWager(completed, trigger));
        metrics.recordSettled(completed.getSettlementOutcome().name());

        log.info("Wager settled ({}): outcome={}, winner={}, payout={}, fee={}",
                trigger, completed.getSettlementOutcome(), completed.getWinnerId(),
                completed.getPayoutAmount(), completed.getPlatformFee());
        return completed;
    }

    private Proof contestedProof(Wager wager) {
        return proofSettlement.contestedProof(store.findProofs(wager.getId()))
                .orElseThrow(() -> new IllegalStateException(
                        "Wager " + wager.getId() + " is " + wager.getStatus() + " but has no proof"));
    }

    private Wager transition(Wager before, Wager after) {
        Wager saved = store.update(after);
        metrics.recordTransition(before.getStatus().name(), saved.getStatus().name());
        log.debug("Wager transitioned {} -> {}", before.getStatus(), saved.getStatus());
        return saved;
    }

    private void publish(WagerEvent event) {
        outboxService.saveEvent(AGGREGATE_TYPE, event.getWagerId(), event.getEventType(), event);
    }

    /**
     * Runs an operation with the wager id in MDC, recording latency and rejections.
     */
    private <T> T run(String operation, UUID wagerId, Supplier<T> body) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.WAGER_ID_MDC_KEY, wagerId.toString());
        try {
            return body.get();
        } catch (WagerException e) {
            metrics.recordRejected(operation, e.getReason());
            log.warn("Wager {} rejected: reason={}, message={}", operation, e.getReason(), e.getMessage());
            throw e;
        } finally {
            metrics.recordOperationLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.WAGER_ID_MDC_KEY);
        }
    }

    private void validateNewWager(NewWager request) {
        requireId(request.getCreatorId(), "creator");
        long min = properties.getStake().getMin();
        long max = properties.getStake().getMax();
        if (request.getStakeAmount() < min || request.getStakeAmount() > max) {
            throw new WagerValidationException(WagerValidationException.INVALID_STAKE,
                    String.format("Stake must be between %d and %d, got %d", min, max, request.getStakeAmount()));
        }
        if (request.getGame() == null || request.getGame().isBlank()) {
            throw new WagerValidationException(WagerValidationException.INVALID_REQUEST, "Game is required");
        }
        if (request.getGame().trim().length() > MAX_GAME_LENGTH) {
            throw new WagerValidationException(WagerValidationException.INVALID_REQUEST,
                    "Game must be at most " + MAX_GAME_LENGTH + " characters");
        }
        if (request.getTitle() != null && request.getTitle().trim().length() > MAX_TITLE_LENGTH) {
            throw new WagerValidationException(WagerValidationException.INVALID_REQUEST,
                    "Title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        if (request.getDescription() != null && request.getDescription().trim().length() > MAX_TEXT_LENGTH) {
            throw new WagerValidationException(WagerValidationException.INVALID_REQUEST,
                    "Description must be at most " + MAX_TEXT_LENGTH + " characters");
        }
        if (request.getCreatorId().equals(request.getTargetUserId())) {
            throw new WagerValidationException(WagerValidationException.SELF_CHALLENGE,
                    "Creator cannot target themselves");
        }
        if (request.getIdempotencyKey() != null && request.getIdempotencyKey().isBlank()) {
            throw new WagerValidationException(WagerValidationException.INVALID_REQUEST,
                    "Idempotency-Key must not be blank");
        }
    }

    private void validateProof(UUID claimedWinnerId, String evidenceUrl, EvidenceType evidenceType) {
        if (claimedWinnerId == null) {
            throw new WagerValidationException(WagerValidationException.MALFORMED_PROOF, "Claimed winner is required");
        }
        if (evidenceType == null) {
            throw new WagerValidationException(WagerValidationException.MALFORMED_PROOF, "Evidence type is required");
        }
        if (evidenceUrl == null || evidenceUrl.isBlank() || evidenceUrl.length() > MAX_URL_LENGTH) {
            throw new WagerValidationException(WagerValidationException.MALFORMED_PROOF,
                    "Evidence URL is required and must be at most " + MAX_URL_LENGTH + " characters");
        }
        try {
            URI uri = new URI(evidenceUrl.trim());
            String scheme = uri.getScheme();
            if (uri.getHost() == null || scheme == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new WagerValidationException(WagerValidationException.MALFORMED_PROOF,
                        "Evidence URL must be an absolute http(s) URL");
            }
        } catch (URISyntaxException e) {
            throw new WagerValidationException(WagerValidationException.MALFORMED_PROOF,
                    "Evidence URL is not a valid URL: " + e.getMessage());
        }
    }

    private static void requireId(UUID id, String role) {
        if (id == null) {
            throw new WagerValidationException(WagerValidationException.INVALID_REQUEST, role + " id is required");
        }
    }

    private static void requireParticipant(Wager wager, UUID userId) {
        if (!wager.isParticipant(userId)) {
            throw new WagerPermissionException(WagerPermissionException.NOT_PARTICIPANT,
                    "User " + userId + " is not a participant of wager " + wager.getId());
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
