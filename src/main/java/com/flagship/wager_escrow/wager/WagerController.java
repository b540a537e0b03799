package com.flagship.wager_escrow.wager;

import com.flagship.wager_escrow.wager.dto.CreateWagerRequest;
import com.flagship.wager_escrow.wager.dto.DisputeResponse;
import com.flagship.wager_escrow.wager.dto.OpenDisputeRequest;
import com.flagship.wager_escrow.wager.dto.SubmitProofRequest;
import com.flagship.wager_escrow.wager.dto.UserWagerStatsResponse;
import com.flagship.wager_escrow.wager.dto.WagerResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST API for the wager lifecycle.
 *
 * The acting user comes from the X-User-Id header; authentication happens
 * upstream. Every mutating endpoint answers with a fresh snapshot.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class WagerController {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final WagerStateMachine stateMachine;
    private final DisputeArbitrationService arbitrationService;
    private final WagerQueryService queryService;

    /**
     * 201 for a new wager, 200 when the Idempotency-Key replays an earlier create.
     */
    @PostMapping("/wagers")
    public ResponseEntity<WagerResponse> createWager(
            @Valid @RequestBody CreateWagerRequest request,
            @RequestHeader(USER_ID_HEADER) UUID userId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received wager creation request: creator={}, stake={}, game={}, idempotencyKey={}",
                userId, request.getStakeAmount(), request.getGame(), idempotencyKey);

        CreatedWager created = stateMachine.create(NewWager.builder()
                .creatorId(userId)
                .stakeAmount(request.getStakeAmount())
                .game(request.getGame())
                .targetUserId(request.getTargetUserId())
                .title(request.getTitle())
                .description(request.getDescription())
                .idempotencyKey(idempotencyKey)
                .build());

        WagerResponse body = snapshot(created.getWager().getId());
        return created.isReplayed()
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/wagers/{id}/accept")
    public ResponseEntity<WagerResponse> acceptWager(@PathVariable("id") UUID wagerId,
                                                     @RequestHeader(USER_ID_HEADER) UUID userId) {
        stateMachine.accept(wagerId, userId);
        return ResponseEntity.ok(snapshot(wagerId));
    }

    @PostMapping("/wagers/{id}/start")
    public ResponseEntity<WagerResponse> startWager(@PathVariable("id") UUID wagerId,
                                                    @RequestHeader(USER_ID_HEADER) UUID userId) {
        stateMachine.start(wagerId, userId);
        return ResponseEntity.ok(snapshot(wagerId));
    }

    @PostMapping("/wagers/{id}/proofs")
    public ResponseEntity<WagerResponse> submitProof(@PathVariable("id") UUID wagerId,
                                                     @RequestHeader(USER_ID_HEADER) UUID userId,
                                                     @Valid @RequestBody SubmitProofRequest request) {
        stateMachine.submitProof(wagerId, userId, request.getClaimedWinnerId(),
                request.getEvidenceUrl(), request.getEvidenceType());
        return ResponseEntity.status(HttpStatus.CREATED).body(snapshot(wagerId));
    }

    @PostMapping("/wagers/{id}/disputes")
    public ResponseEntity<DisputeResponse> openDispute(@PathVariable("id") UUID wagerId,
                                                       @RequestHeader(USER_ID_HEADER) UUID userId,
                                                       @Valid @RequestBody OpenDisputeRequest request) {
        Dispute dispute = arbitrationService.openDispute(wagerId, userId, request.getReason());
        return ResponseEntity.status(HttpStatus.CREATED).body(DisputeResponse.from(dispute));
    }

    @PostMapping("/wagers/{id}/cancel")
    public ResponseEntity<WagerResponse> cancelWager(@PathVariable("id") UUID wagerId,
                                                     @RequestHeader(USER_ID_HEADER) UUID userId) {
        stateMachine.cancel(wagerId, userId);
        return ResponseEntity.ok(snapshot(wagerId));
    }

    @GetMapping("/wagers/{id}")
    public ResponseEntity<WagerResponse> getWager(@PathVariable("id") UUID wagerId) {
        return ResponseEntity.ok(snapshot(wagerId));
    }

    /**
     * {@code scope=active} (default) or {@code scope=closed}.
     */
    @GetMapping("/wagers")
    public ResponseEntity<List<WagerResponse>> listWagers(@RequestParam("user_id") UUID userId,
                                                          @RequestParam(value = "scope", defaultValue = "active")
                                                          WagerScope scope) {
        List<WagerSnapshot> wagers = scope == WagerScope.CLOSED
                ? queryService.listClosedWagers(userId)
                : queryService.listActiveWagers(userId);
        return ResponseEntity.ok(wagers.stream().map(WagerResponse::from).toList());
    }

    @GetMapping("/users/{userId}/wager-stats")
    public ResponseEntity<UserWagerStatsResponse> getUserStats(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(UserWagerStatsResponse.from(queryService.getUserStats(userId)));
    }

    private WagerResponse snapshot(UUID wagerId) {
        return WagerResponse.from(queryService.getSnapshot(wagerId));
    }
}
