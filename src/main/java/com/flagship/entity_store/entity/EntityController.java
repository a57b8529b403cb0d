package com.flagship.entity_store.entity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.entity_store.entity.dto.AppendEventRequest;
import com.flagship.entity_store.entity.dto.AppendResponse;
import com.flagship.entity_store.entity.dto.CreateEntityRequest;
import com.flagship.entity_store.entity.dto.EntityListResponse;
import com.flagship.entity_store.entity.dto.EventResponse;
import com.flagship.entity_store.entity.dto.SnapshotResponse;
import com.flagship.entity_store.entity.exception.EntityNotFoundException;
import com.flagship.entity_store.projection.DivergenceReport;
import com.flagship.entity_store.projection.MaterializedViewStore;
import com.flagship.entity_store.projection.ProjectionMaintenanceService;
import com.flagship.entity_store.reconstruct.PointInTimeReconstructor;
import com.flagship.entity_store.snapshot.SnapshotManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * REST surface of the entity store: writes go through the append API, reads come
 * from the materialized view or from point-in-time reconstruction.
 *
 * {@code {type}} is the entity type's wire name ({@code contact}, {@code company}).
 * An {@code Idempotency-Key} header becomes the append's dedup key.
 */
@RestController
@RequestMapping("/api/entities/{type}")
@RequiredArgsConstructor
@Slf4j
public class EntityController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String ACTOR_HEADER = "X-Actor-Id";

    private final EntityEventService entityEventService;
    private final MaterializedViewStore viewStore;
    private final PointInTimeReconstructor reconstructor;
    private final ProjectionMaintenanceService maintenanceService;
    private final SnapshotManager snapshotManager;
    private final ObjectMapper objectMapper;

    @PostMapping
    public ResponseEntity<AppendResponse> create(
            @PathVariable("type") String type,
            @RequestBody CreateEntityRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId) {
        EntityType entityType = EntityType.fromWireName(type);
        log.info("Received create request: type={}, idempotencyKey={}", entityType.wireName(), idempotencyKey);

        AppendResult result = entityEventService.create(entityType, request.getId(), request.toPayload(),
            actorId, idempotencyKey);
        return respond(result);
    }

    @GetMapping
    public EntityListResponse list(@PathVariable("type") String type,
                                   @RequestParam(value = "limit", defaultValue = "50") int limit,
                                   @RequestParam(value = "offset", defaultValue = "0") int offset) {
        if (limit < 1 || limit > 500 || offset < 0) {
            throw new IllegalArgumentException("limit must be 1..500 and offset non-negative");
        }
        EntityType entityType = EntityType.fromWireName(type);
        return new EntityListResponse(viewStore.list(entityType, limit, offset),
            viewStore.countListable(entityType), limit, offset);
    }

    @GetMapping("/{id}")
    public EntityState get(@PathVariable("type") String type, @PathVariable("id") UUID id) {
        return entityEventService.getState(ref(type, id));
    }

    /**
     * Entities owning an identifier, matched case-insensitively.
     */
    @GetMapping("/lookup")
    public List<EntityState> lookup(@PathVariable("type") String type,
                                    @RequestParam("identifierType") String identifierType,
                                    @RequestParam("value") String value) {
        return viewStore.findByIdentifier(EntityType.fromWireName(type), identifierType, value).stream()
            .map(viewStore::load)
            .flatMap(Optional::stream)
            .toList();
    }

    @PostMapping("/{id}/events")
    public ResponseEntity<AppendResponse> appendEvent(
            @PathVariable("type") String type,
            @PathVariable("id") UUID id,
            @Valid @RequestBody AppendEventRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId) {
        EntityRef ref = ref(type, id);
        log.debug("Received {} for {}", request.getEventType(), ref);
        return respond(entityEventService.append(ref, request.getEventType(), request.getPayload(), actorId,
            idempotencyKey));
    }

    @GetMapping("/{id}/events")
    public List<EventResponse> readEvents(@PathVariable("type") String type,
                                          @PathVariable("id") UUID id,
                                          @RequestParam(value = "after", defaultValue = "0") long after) {
        return entityEventService.readEvents(ref(type, id), after).stream()
            .map(event -> EventResponse.from(event, objectMapper))
            .toList();
    }

    /**
     * State as of a past instant (ISO-8601). 404 if the entity did not exist then.
     */
    @GetMapping("/{id}/as-of")
    public EntityState asOf(@PathVariable("type") String type,
                            @PathVariable("id") UUID id,
                            @RequestParam("at") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant at) {
        EntityRef ref = ref(type, id);
        EntityState state = reconstructor.stateAsOf(ref, at);
        if (!state.exists()) {
            throw new EntityNotFoundException("entity " + ref + " as of", at);
        }
        return state;
    }

    @DeleteMapping("/{id}")
    public AppendResponse delete(@PathVariable("type") String type,
                                 @PathVariable("id") UUID id,
                                 @RequestParam(value = "reason", required = false) String reason,
                                 @RequestHeader(value = ACTOR_HEADER, required = false) String actorId) {
        return AppendResponse.from(entityEventService.delete(ref(type, id), reason, actorId), objectMapper);
    }

    // ==================== Maintenance ====================

    @PostMapping("/{id}/rebuild")
    public DivergenceReport rebuild(@PathVariable("type") String type, @PathVariable("id") UUID id) {
        return maintenanceService.rebuild(ref(type, id));
    }

    @GetMapping("/{id}/verify")
    public DivergenceReport verify(@PathVariable("type") String type, @PathVariable("id") UUID id) {
        return maintenanceService.verify(ref(type, id));
    }

    @PostMapping("/{id}/snapshots")
    public ResponseEntity<SnapshotResponse> takeSnapshot(@PathVariable("type") String type,
                                                         @PathVariable("id") UUID id) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(SnapshotResponse.from(snapshotManager.takeSnapshot(ref(type, id))));
    }

    @GetMapping("/{id}/snapshots")
    public List<SnapshotResponse> listSnapshots(@PathVariable("type") String type, @PathVariable("id") UUID id) {
        return snapshotManager.listSnapshots(ref(type, id)).stream()
            .map(SnapshotResponse::from)
            .toList();
    }

    private ResponseEntity<AppendResponse> respond(AppendResult result) {
        return ResponseEntity.status(result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(AppendResponse.from(result, objectMapper));
    }

    private static EntityRef ref(String type, UUID id) {
        return EntityRef.of(EntityType.fromWireName(type), id);
    }
}
