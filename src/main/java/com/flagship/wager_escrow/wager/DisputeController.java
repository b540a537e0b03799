package com.flagship.wager_escrow.wager;

import com.flagship.wager_escrow.wager.dto.AssignModeratorRequest;
import com.flagship.wager_escrow.wager.dto.DisputeResponse;
import com.flagship.wager_escrow.wager.dto.ResolveDisputeRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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
 * Moderator endpoints. The moderator role is checked by the gateway; this
 * layer only knows the X-Moderator-Id of the caller.
 */
@RestController
@RequestMapping("/api/disputes")
@RequiredArgsConstructor
@Slf4j
public class DisputeController {

    static final String MODERATOR_ID_HEADER = "X-Moderator-Id";

    private final DisputeArbitrationService arbitrationService;

    @GetMapping("/{id}")
    public ResponseEntity<DisputeResponse> getDispute(@PathVariable("id") UUID disputeId) {
        return ResponseEntity.ok(DisputeResponse.from(arbitrationService.getDispute(disputeId)));
    }

    /**
     * Assigns the moderator in the body, or the next one from the pool when the body names none.
     */
    @PostMapping("/{id}/assignment")
    public ResponseEntity<DisputeResponse> assignModerator(@PathVariable("id") UUID disputeId,
                                                           @RequestHeader(MODERATOR_ID_HEADER) UUID moderatorId,
                                                           @RequestBody(required = false) AssignModeratorRequest request) {
        UUID assignee = request != null ? request.getModeratorId() : null;
        log.info("Moderator {} assigning dispute {} to {}", moderatorId, disputeId,
                assignee != null ? assignee : "next in pool");
        return ResponseEntity.ok(DisputeResponse.from(arbitrationService.assignModerator(disputeId, assignee)));
    }

    @PostMapping("/{id}/resolution")
    public ResponseEntity<DisputeResponse> resolveDispute(@PathVariable("id") UUID disputeId,
                                                          @RequestHeader(MODERATOR_ID_HEADER) UUID moderatorId,
                                                          @Valid @RequestBody ResolveDisputeRequest request) {
        log.info("Moderator {} resolving dispute {} as {}", moderatorId, disputeId, request.getResolution());
        Dispute resolved = arbitrationService.resolveDispute(disputeId, moderatorId,
                request.getResolution(), request.getNotes());
        return ResponseEntity.ok(DisputeResponse.from(resolved));
    }
}
