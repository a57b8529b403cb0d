package com.flagship.entity_store.merge;

import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.merge.dto.ApproveCandidateRequest;
import com.flagship.entity_store.merge.dto.MatchCandidateResponse;
import com.flagship.entity_store.merge.dto.MergeResponse;
import com.flagship.entity_store.merge.dto.RejectCandidateRequest;
import com.flagship.entity_store.merge.dto.SplitRequest;
import com.flagship.entity_store.merge.dto.SubmitCandidateRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Review queue for match candidates: submit, inspect, approve (merge), reject and
 * split.
 */
@RestController
@RequestMapping("/api/match-candidates")
@RequiredArgsConstructor
@Slf4j
public class MatchCandidateController {

    private final MergeCoordinator mergeCoordinator;

    /**
     * Submits a candidate pair. A pair that is already pending returns the existing
     * candidate; a high-confidence pair comes back AUTO_MERGED.
     */
    @PostMapping
    public ResponseEntity<MatchCandidateResponse> submit(@Valid @RequestBody SubmitCandidateRequest request) {
        EntityRef entityA = EntityRef.parse(request.getEntityA());
        EntityRef entityB = EntityRef.parse(request.getEntityB());
        log.info("Received match candidate: {} <-> {} (confidence={})", entityA, entityB, request.getConfidence());

        MatchCandidate candidate = mergeCoordinator.submit(entityA, entityB, request.getConfidence(),
            request.getSignals(), request.getSubmittedBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(MatchCandidateResponse.from(candidate));
    }

    @GetMapping
    public List<MatchCandidateResponse> list(@RequestParam(value = "status", required = false) MatchStatus status) {
        return mergeCoordinator.listCandidates(status).stream()
            .map(MatchCandidateResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public MatchCandidateResponse get(@PathVariable("id") UUID id) {
        return MatchCandidateResponse.from(mergeCoordinator.getCandidate(id));
    }

    @GetMapping("/{id}/preview")
    public MergePreview preview(@PathVariable("id") UUID id) {
        return mergeCoordinator.preview(id);
    }

    @PostMapping("/{id}/approve")
    public MergeResponse approve(@PathVariable("id") UUID id, @Valid @RequestBody ApproveCandidateRequest request) {
        return MergeResponse.from(mergeCoordinator.approve(id, request.getSurvivorId(), request.getReviewer(),
            request.getFieldOverrides()));
    }

    @PostMapping("/{id}/reject")
    public MatchCandidateResponse reject(@PathVariable("id") UUID id,
                                         @Valid @RequestBody RejectCandidateRequest request) {
        return MatchCandidateResponse.from(mergeCoordinator.reject(id, request.getReviewer(), request.getNotes()));
    }

    @PostMapping("/{id}/split")
    public MergeResponse split(@PathVariable("id") UUID id, @Valid @RequestBody SplitRequest request) {
        return MergeResponse.from(mergeCoordinator.split(id, request.getActor()));
    }
}
