package com.flagship.wager_escrow.wager;

import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads the outcome out of a wager's proofs. Stateless; never touches storage.
 */
@Service
public class ProofSettlementService {

    /**
     * @param proofs proofs of one wager in submission order, at most one per participant
     */
    public ProofConsensus evaluate(List<Proof> proofs) {
        if (proofs.size() < 2) {
            return ProofConsensus.awaitingSecondProof();
        }
        if (proofs.size() > 2) {
            throw new IllegalStateException("A wager has at most two proofs, got " + proofs.size());
        }
        Proof first = proofs.get(0);
        Proof second = proofs.get(1);
        if (first.getSubmitterId().equals(second.getSubmitterId())) {
            throw new IllegalStateException("Both proofs come from submitter " + first.getSubmitterId());
        }
        return first.agreesWith(second)
                ? ProofConsensus.agreed(first.getClaimedWinnerId())
                : ProofConsensus.conflicting();
    }

    /**
     * The earliest proof. Its claim is the one a dispute contests and the one
     * that stands when the dispute window lapses.
     */
    public Optional<Proof> contestedProof(List<Proof> proofs) {
        return proofs.isEmpty() ? Optional.empty() : Optional.of(proofs.get(0));
    }

    /**
     * Winner under a moderator's decision; null for {@link DisputeResolution#VOID}.
     */
    public UUID winnerFor(DisputeResolution resolution, Wager wager, Proof contested) {
        return switch (resolution) {
            case CONFIRM_ORIGINAL -> contested.getClaimedWinnerId();
            case REVERSE -> wager.counterpartyOf(contested.getClaimedWinnerId());
            case VOID -> null;
        };
    }
}
