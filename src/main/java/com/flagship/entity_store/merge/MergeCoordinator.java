package com.flagship.entity_store.merge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.entity_store.entity.Affiliation;
import com.flagship.entity_store.entity.AppendResult;
import com.flagship.entity_store.entity.ContactMethod;
import com.flagship.entity_store.entity.EntityEventService;
import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityState;
import com.flagship.entity_store.entity.Identifier;
import com.flagship.entity_store.entity.OwnedItem;
import com.flagship.entity_store.entity.ProvenanceRecord;
import com.flagship.entity_store.entity.WriteRetrier;
import com.flagship.entity_store.entity.exception.EntityNotFoundException;
import com.flagship.entity_store.entity.exception.EntityStateException;
import com.flagship.entity_store.event.EventType;
import com.flagship.entity_store.event.SequenceAllocator;
import com.flagship.entity_store.event.payload.AffiliationsRepointed;
import com.flagship.entity_store.event.payload.EntityCreated;
import com.flagship.entity_store.event.payload.EntityMerged;
import com.flagship.entity_store.event.payload.EntitySplit;
import com.flagship.entity_store.event.payload.MergeRole;
import com.flagship.entity_store.observability.EntityStoreMetrics;
import com.flagship.entity_store.projection.MaterializedViewStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Consolidates two identities into one and reverses it.
 *
 * Merge and split each run as one serializable transaction holding the write locks of
 * every entity whose stream they append to. Either all of it commits (both event
 * streams, both materialized rows, the candidate and the audit record) or none of it.
 * Serialization failures and ordering conflicts re-run the whole operation.
 *
 * Items keep their id and origin across a merge, so a split can hand back exactly what
 * came from the absorbed identity, including identities merged into it earlier. The
 * entity a split creates becomes the origin of everything it takes back.
 *
 * An identifier the survivor already holds (same type and value) is not copied over;
 * a split restores it from the absorbed identity's pre-merge state. Affiliations other
 * entities hold with an absorbed organization are re-pointed to the survivor in the
 * same transaction, and back to the recreated organization on split.
 */
@Service
@Slf4j
public class MergeCoordinator {

    static final String SYSTEM_ACTOR = "system";

    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate serializableTransaction;
    private final MatchCandidatePersistenceService persistence;
    private final EntityEventService entityEventService;
    private final SequenceAllocator sequenceAllocator;
    private final MaterializedViewStore viewStore;
    private final WriteRetrier retrier;
    private final EntityStoreMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final double autoMergeThreshold;
    private final boolean autoMergeEnabled;

    public MergeCoordinator(PlatformTransactionManager transactionManager,
                            MatchCandidatePersistenceService persistence,
                            EntityEventService entityEventService,
                            SequenceAllocator sequenceAllocator,
                            MaterializedViewStore viewStore,
                            WriteRetrier retrier,
                            EntityStoreMetrics metrics,
                            ObjectMapper objectMapper,
                            Clock clock,
                            @Value("${entity-store.merge.auto-merge-threshold:0.95}") double autoMergeThreshold,
                            @Value("${entity-store.merge.auto-merge-enabled:true}") boolean autoMergeEnabled) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.serializableTransaction = new TransactionTemplate(transactionManager);
        this.serializableTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_SERIALIZABLE);
        this.persistence = persistence;
        this.entityEventService = entityEventService;
        this.sequenceAllocator = sequenceAllocator;
        this.viewStore = viewStore;
        this.retrier = retrier;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.autoMergeThreshold = autoMergeThreshold;
        this.autoMergeEnabled = autoMergeEnabled;
    }

    // ==================== Review queue ====================

    /**
     * Records a candidate pair. A pair that already has a pending candidate returns that
     * one. At or above the auto-merge threshold the pair is merged right away with the
     * default survivor.
     */
    public MatchCandidate submit(EntityRef entityA, EntityRef entityB, double confidence,
                                 Map<String, Double> signals, String submittedBy) {
        if (entityA.type() != entityB.type()) {
            throw new IllegalArgumentException(
                String.format("Cannot match a %s with a %s", entityA.type().wireName(), entityB.type().wireName()));
        }
        requireActive(entityA, loadExisting(entityA));
        requireActive(entityB, loadExisting(entityB));

        MatchCandidate candidate = transactionTemplate.execute(status -> {
            List<MatchCandidate> pending = persistence.findPendingForPair(entityA.id(), entityB.id());
            if (!pending.isEmpty()) {
                log.info("Pending candidate {} already covers {} and {}", pending.get(0).getId(), entityA, entityB);
                return pending.get(0);
            }
            return persistence.save(MatchCandidate.submit(entityA.type(), entityA.id(), entityB.id(), confidence,
                signals, submittedBy, clock.instant()));
        });

        log.info("Submitted match candidate {}: {} <-> {} (confidence={})",
            candidate.getId(), entityA, entityB, confidence);
        metrics.recordMerge(entityA.type().wireName(), "submitted");

        if (autoMergeEnabled && candidate.getStatus() == MatchStatus.PENDING
                && candidate.getConfidence() >= autoMergeThreshold) {
            return merge(candidate.getId(), null, SYSTEM_ACTOR, Map.of(), true).getCandidate();
        }
        return candidate;
    }

    public MergeResult approve(UUID candidateId, UUID survivorId, String reviewer, Map<String, String> fieldOverrides) {
        return merge(candidateId, survivorId, reviewer, fieldOverrides != null ? fieldOverrides : Map.of(), false);
    }

    public MatchCandidate reject(UUID candidateId, String reviewer, String notes) {
        MatchCandidate rejected = retrier.execute("reject", () -> transactionTemplate.execute(status -> {
            MatchCandidate candidate = persistence.getById(candidateId);
            return persistence.update(candidate.reject(reviewer, notes, clock.instant()));
        }));
        metrics.recordMerge(rejected.getEntityType().wireName(), "rejected");
        log.info("Rejected match candidate {} by {}", candidateId, reviewer);
        return rejected;
    }

    public MatchCandidate getCandidate(UUID candidateId) {
        return persistence.getById(candidateId);
    }

    public List<MatchCandidate> listCandidates(MatchStatus status) {
        return persistence.list(status);
    }

    /**
     * Shows what merging a candidate would combine. Both entities must still exist.
     */
    public MergePreview preview(UUID candidateId) {
        MatchCandidate candidate = persistence.getById(candidateId);
        EntityState a = loadExisting(participant(candidate, candidate.getEntityAId()));
        EntityState b = loadExisting(participant(candidate, candidate.getEntityBId()));

        Map<String, List<String>> conflicts = new LinkedHashMap<>();
        for (Map.Entry<String, String> field : a.getFields().entrySet()) {
            String other = b.getFields().get(field.getKey());
            if (other != null && !other.equals(field.getValue())) {
                conflicts.put(field.getKey(), List.of(field.getValue(), other));
            }
        }

        Map<String, Integer> countsA = counts(a);
        Map<String, Integer> countsB = counts(b);
        Map<String, Integer> combined = new LinkedHashMap<>();
        countsA.forEach((key, count) -> combined.put(key, count + countsB.getOrDefault(key, 0)));

        return MergePreview.builder()
            .candidateId(candidateId)
            .entityA(a)
            .entityB(b)
            .conflictingFields(conflicts)
            .countsA(countsA)
            .countsB(countsB)
            .combined(combined)
            .build();
    }

    // ==================== Merge ====================

    MergeResult merge(UUID candidateId, UUID survivorId, String actor, Map<String, String> fieldOverrides,
                      boolean automatic) {
        MergeResult result = retrier.execute("merge", () -> serializableTransaction.execute(
            status -> mergeInTransaction(candidateId, survivorId, actor, fieldOverrides, automatic)));
        metrics.recordMerge(result.getCandidate().getEntityType().wireName(),
            result.getCandidate().getStatus().name().toLowerCase());
        log.info("Merged {} into {} (candidate={}, by={})", result.getAbsorbed().getRef(),
            result.getSurvivor().getRef(), candidateId, actor);
        return result;
    }

    private MergeResult mergeInTransaction(UUID candidateId, UUID chosenSurvivor, String actor,
                                           Map<String, String> fieldOverrides, boolean automatic) {
        MatchCandidate candidate = persistence.getById(candidateId);
        if (candidate.getStatus() != MatchStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Candidate %s is %s; only PENDING candidates can be merged", candidateId,
                    candidate.getStatus()));
        }
        EntityRef refA = participant(candidate, candidate.getEntityAId());
        EntityRef refB = participant(candidate, candidate.getEntityBId());
        sequenceAllocator.lockAll(List.of(refA, refB));

        EntityState stateA = loadExisting(refA);
        EntityState stateB = loadExisting(refB);
        requireActive(refA, stateA);
        requireActive(refB, stateB);

        UUID survivorId = chosenSurvivor != null ? chosenSurvivor : defaultSurvivor(stateA, stateB);
        Instant now = clock.instant();
        MatchCandidate reviewed = automatic
            ? candidate.autoMerge(survivorId, now)
            : candidate.approve(survivorId, actor, now);

        EntityState survivor = survivorId.equals(refA.id()) ? stateA : stateB;
        EntityState absorbed = survivorId.equals(refA.id()) ? stateB : stateA;
        checkFieldOverrides(fieldOverrides);

        Set<String> survivorIdentifiers = survivor.getIdentifiers().stream()
            .map(MergeCoordinator::identifierKey)
            .collect(Collectors.toSet());
        List<Identifier> movedIdentifiers = absorbed.getIdentifiers().stream()
            .filter(identifier -> !survivorIdentifiers.contains(identifierKey(identifier)))
            .toList();
        if (movedIdentifiers.size() < absorbed.getIdentifiers().size()) {
            log.debug("{} identifiers of {} already held by {}; not copied",
                absorbed.getIdentifiers().size() - movedIdentifiers.size(), absorbed.getRef(), survivor.getRef());
        }

        EntityMerged survivorEvent = EntityMerged.builder()
            .role(MergeRole.SURVIVOR)
            .counterpartId(absorbed.getRef().id())
            .candidateId(candidateId)
            .confidence(candidate.getConfidence())
            .signals(candidate.getSignals())
            .identifiers(movedIdentifiers)
            .contactMethods(absorbed.getContactMethods())
            .affiliations(absorbed.getAffiliations())
            .provenance(absorbed.getProvenance())
            .fieldOverrides(fieldOverrides)
            .build();
        EntityMerged absorbedEvent = EntityMerged.builder()
            .role(MergeRole.ABSORBED)
            .counterpartId(survivor.getRef().id())
            .candidateId(candidateId)
            .confidence(candidate.getConfidence())
            .signals(candidate.getSignals())
            .build();

        AppendResult survivorResult = entityEventService.appendInTransaction(
            survivor.getRef(), EventType.MERGED, survivorEvent, actor, null);
        AppendResult absorbedResult = entityEventService.appendInTransaction(
            absorbed.getRef(), EventType.MERGED, absorbedEvent, actor, null);
        List<UUID> repointed = repointAffiliations(absorbed.getRef(), survivor.getRef(), null, candidateId, actor);

        MergeRecord record = persistence.saveMergeRecord(new MergeRecord(
            UUID.randomUUID(),
            candidateId,
            candidate.getEntityType(),
            survivor.getRef().id(),
            absorbed.getRef().id(),
            toJson(absorbed),
            movedIdentifiers.size(),
            absorbed.getContactMethods().size(),
            absorbed.getAffiliations().size(),
            absorbed.getProvenance().size(),
            repointed,
            actor,
            now,
            null,
            null,
            null
        ));
        MatchCandidate saved = persistence.update(reviewed);

        return new MergeResult(saved, survivorResult.getState(), absorbedResult.getState(), record);
    }

    // ==================== Split ====================

    /**
     * Reverses the candidate's merge: a new entity takes back everything that originated
     * from the absorbed identity and its own merge chain.
     */
    public SplitResult split(UUID candidateId, String actor) {
        SplitResult result = retrier.execute("split", () -> serializableTransaction.execute(
            status -> splitInTransaction(candidateId, actor)));
        metrics.recordSplit(result.getCandidate().getEntityType().wireName());
        log.info("Split {} off {} (candidate={}, by={})", result.getSplitEntity().getRef(),
            result.getSurvivor().getRef(), candidateId, actor);
        return result;
    }

    private SplitResult splitInTransaction(UUID candidateId, String actor) {
        MatchCandidate candidate = persistence.getById(candidateId);
        Instant now = clock.instant();
        MatchCandidate reverted = candidate.split(actor, now);

        MergeRecord record = persistence.findActiveMergeRecord(candidateId)
            .orElseThrow(() -> new IllegalStateException("Candidate " + candidateId + " has no merge to split"));
        if (record.getSurvivorId() == null || record.getAbsorbedId() == null) {
            throw new IllegalStateException("Merge " + record.getId() + " references an erased entity");
        }
        EntityRef survivorRef = EntityRef.of(record.getEntityType(), record.getSurvivorId());
        EntityRef absorbedRef = EntityRef.of(record.getEntityType(), record.getAbsorbedId());
        EntityRef newRef = EntityRef.of(record.getEntityType(), UUID.randomUUID());

        sequenceAllocator.lock(survivorRef);
        EntityState survivor = loadExisting(survivorRef);
        requireActive(survivorRef, survivor);

        Set<UUID> chain = mergeChain(absorbedRef);
        List<ProvenanceRecord> movedProvenance = survivor.getProvenance().stream()
            .filter(p -> chain.contains(p.getOriginEntityId()))
            .toList();
        Set<UUID> movedProvenanceIds = new LinkedHashSet<>();
        movedProvenance.forEach(p -> movedProvenanceIds.add(p.getId()));

        Predicate<OwnedItem> moves = item -> chain.contains(item.getOriginEntityId())
            || (item.getProvenanceId() != null && movedProvenanceIds.contains(item.getProvenanceId()));
        List<Identifier> identifiers = survivor.getIdentifiers().stream().filter(moves).toList();
        List<ContactMethod> contactMethods = survivor.getContactMethods().stream().filter(moves).toList();
        List<Affiliation> affiliations = survivor.getAffiliations().stream().filter(moves).toList();

        EntityState preMerge = preMergeState(record);
        Set<UUID> survivorItemIds = survivor.getIdentifiers().stream().map(Identifier::getId).collect(Collectors.toSet());
        Set<String> survivorIdentifiers = survivor.getIdentifiers().stream()
            .map(MergeCoordinator::identifierKey)
            .collect(Collectors.toSet());
        List<Identifier> restoredIdentifiers = preMerge.getIdentifiers().stream()
            .filter(identifier -> !survivorItemIds.contains(identifier.getId()))
            .filter(identifier -> survivorIdentifiers.contains(identifierKey(identifier)))
            .toList();

        UUID origin = newRef.id();
        EntityCreated created = EntityCreated.builder()
            .fields(preMerge.getFields())
            .identifiers(Stream.concat(identifiers.stream(), restoredIdentifiers.stream())
                .map(i -> i.toBuilder().originEntityId(origin).build())
                .toList())
            .contactMethods(contactMethods.stream().map(c -> c.toBuilder().originEntityId(origin).build()).toList())
            .affiliations(affiliations.stream().map(a -> a.toBuilder().originEntityId(origin).build()).toList())
            .provenance(movedProvenance.stream().map(p -> p.toBuilder().originEntityId(origin).build()).toList())
            .splitFrom(survivorRef.id())
            .candidateId(candidateId)
            .build();
        AppendResult createdResult = entityEventService.appendInTransaction(
            newRef, EventType.CREATED, created, actor, null);

        List<UUID> removedItemIds = Stream.of(identifiers, contactMethods, affiliations)
            .flatMap(List::stream)
            .map(OwnedItem::getId)
            .toList();
        List<UUID> released = chain.stream().filter(id -> !id.equals(absorbedRef.id())).toList();

        EntitySplit splitEvent = EntitySplit.builder()
            .newEntityId(newRef.id())
            .candidateId(candidateId)
            .absorbedEntityId(absorbedRef.id())
            .removedItemIds(removedItemIds)
            .removedProvenanceIds(List.copyOf(movedProvenanceIds))
            .releasedEntityIds(released)
            .build();
        AppendResult splitResult = entityEventService.appendInTransaction(
            survivorRef, EventType.SPLIT, splitEvent, actor, null);
        if (!record.getRepointedAffiliationIds().isEmpty()) {
            repointAffiliations(survivorRef, newRef, new HashSet<>(record.getRepointedAffiliationIds()),
                candidateId, actor);
        }

        MergeRecord splitRecord = persistence.updateMergeRecord(record.markSplit(newRef.id(), actor, now));
        MatchCandidate saved = persistence.update(reverted);

        return new SplitResult(saved, splitResult.getState(), createdResult.getState(), splitRecord);
    }

    /**
     * The absorbed identity plus every identity merged into it, transitively, that was
     * not split off again.
     */
    private Set<UUID> mergeChain(EntityRef absorbed) {
        Set<UUID> chain = new LinkedHashSet<>();
        Deque<UUID> pending = new ArrayDeque<>();
        pending.push(absorbed.id());
        while (!pending.isEmpty()) {
            UUID id = pending.pop();
            if (!chain.add(id)) {
                continue;
            }
            viewStore.load(EntityRef.of(absorbed.type(), id))
                .ifPresent(state -> state.getAbsorbedEntityIds().forEach(pending::push));
        }
        return chain;
    }

    // ==================== Affiliations ====================

    /**
     * Re-points other entities' affiliations with one organization to another, one
     * event per holding entity. With itemIds given, only those items move.
     *
     * @return ids of the affiliation items that moved
     */
    private List<UUID> repointAffiliations(EntityRef from, EntityRef to, Set<UUID> itemIds,
                                           UUID candidateId, String actor) {
        List<EntityRef> holders = viewStore.findAffiliatedWith(from).stream()
            .filter(holder -> !holder.equals(from) && !holder.equals(to))
            .toList();
        if (holders.isEmpty()) {
            return List.of();
        }
        sequenceAllocator.lockAll(holders);

        List<UUID> moved = new ArrayList<>();
        for (EntityRef holder : holders) {
            EntityState state = viewStore.load(holder).orElse(null);
            if (state == null || !state.isActive()) {
                continue;
            }
            List<UUID> items = state.getAffiliations().stream()
                .filter(affiliation -> from.equals(affiliation.getOrganization()))
                .map(Affiliation::getId)
                .filter(id -> itemIds == null || itemIds.contains(id))
                .toList();
            if (items.isEmpty()) {
                continue;
            }
            entityEventService.appendInTransaction(holder, EventType.AFFILIATIONS_REPOINTED,
                AffiliationsRepointed.builder()
                    .fromOrganization(from)
                    .toOrganization(to)
                    .candidateId(candidateId)
                    .itemIds(items)
                    .build(),
                actor, null);
            moved.addAll(items);
        }
        log.info("Re-pointed {} affiliations from {} to {}", moved.size(), from, to);
        return List.copyOf(moved);
    }

    // ==================== Internals ====================

    private EntityState preMergeState(MergeRecord record) {
        if (record.getAbsorbedSnapshot() == null) {
            return EntityState.empty(EntityRef.of(record.getEntityType(), record.getAbsorbedId()));
        }
        try {
            return objectMapper.readValue(record.getAbsorbedSnapshot(), EntityState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable pre-merge state in merge record " + record.getId(), e);
        }
    }

    private static String identifierKey(Identifier identifier) {
        return normalize(identifier.getType()) + "|" + normalize(identifier.getValue());
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private String toJson(EntityState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize pre-merge state of " + state.getRef(), e);
        }
    }

    /**
     * The identity recorded first survives; ties go to entity A.
     */
    private static UUID defaultSurvivor(EntityState a, EntityState b) {
        if (b.getCreatedAt() != null && a.getCreatedAt() != null && b.getCreatedAt().isBefore(a.getCreatedAt())) {
            return b.getRef().id();
        }
        return a.getRef().id();
    }

    private static EntityRef participant(MatchCandidate candidate, UUID id) {
        if (id == null) {
            throw new IllegalStateException("Candidate " + candidate.getId() + " references an erased entity");
        }
        return EntityRef.of(candidate.getEntityType(), id);
    }

    private EntityState loadExisting(EntityRef ref) {
        return viewStore.load(ref).orElseThrow(() -> new EntityNotFoundException(ref));
    }

    private static void requireActive(EntityRef ref, EntityState state) {
        if (!state.isActive()) {
            throw new EntityStateException(ref, state.getStatus(),
                String.format("%s is %s and cannot take part in a merge", ref, state.getStatus()));
        }
    }

    private static void checkFieldOverrides(Map<String, String> overrides) {
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank() || Objects.isNull(entry.getValue())) {
                throw new IllegalArgumentException("Field overrides need a name and a value");
            }
        }
    }

    private static Map<String, Integer> counts(EntityState state) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("identifiers", state.getIdentifiers().size());
        counts.put("contact_methods", state.getContactMethods().size());
        counts.put("affiliations", state.getAffiliations().size());
        counts.put("provenance", state.getProvenance().size());
        return counts;
    }
}
