package com.flagship.entity_store.projection;

import com.flagship.entity_store.entity.Affiliation;
import com.flagship.entity_store.entity.EntityState;
import com.flagship.entity_store.entity.EntityStatus;
import com.flagship.entity_store.entity.OwnedItem;
import com.flagship.entity_store.entity.ProvenanceRecord;
import com.flagship.entity_store.event.StoredEvent;
import com.flagship.entity_store.event.payload.AffiliationAdded;
import com.flagship.entity_store.event.payload.AffiliationEnded;
import com.flagship.entity_store.event.payload.AffiliationsRepointed;
import com.flagship.entity_store.event.payload.ContactMethodAdded;
import com.flagship.entity_store.event.payload.EntityCreated;
import com.flagship.entity_store.event.payload.EntityDeleted;
import com.flagship.entity_store.event.payload.EntityMerged;
import com.flagship.entity_store.event.payload.EntitySplit;
import com.flagship.entity_store.event.payload.FieldsUpdated;
import com.flagship.entity_store.event.payload.IdentifierAdded;
import com.flagship.entity_store.event.payload.ItemRemoved;
import com.flagship.entity_store.event.payload.MergeRole;
import com.flagship.entity_store.event.payload.ProvenanceRecorded;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;

/**
 * Fold steps for every cataloged event type.
 *
 * Each method is total over its payload: removing an item that is not there, or
 * ending an affiliation twice, leaves the collection unchanged. Lifecycle checks
 * belong to the write path, not here.
 */
final class EntityEventHandlers {

    private EntityEventHandlers() {
    }

    static EntityState created(EntityState state, EntityCreated payload, StoredEvent event) {
        return state.toBuilder()
            .status(EntityStatus.ACTIVE)
            .fields(withChanges(Map.of(), payload.getFields(), List.of()))
            .identifiers(List.copyOf(payload.getIdentifiers()))
            .contactMethods(List.copyOf(payload.getContactMethods()))
            .affiliations(List.copyOf(payload.getAffiliations()))
            .provenance(List.copyOf(payload.getProvenance()))
            .splitFrom(payload.getSplitFrom())
            .createdAt(event.getOccurredAt())
            .build();
    }

    static EntityState updated(EntityState state, FieldsUpdated payload, StoredEvent event) {
        return state.toBuilder()
            .fields(withChanges(state.getFields(), payload.getSet(), payload.getCleared()))
            .build();
    }

    static EntityState identifierAdded(EntityState state, IdentifierAdded payload, StoredEvent event) {
        return state.toBuilder()
            .identifiers(upsert(state.getIdentifiers(), List.of(payload.getIdentifier()), OwnedItem::getId))
            .build();
    }

    static EntityState identifierRemoved(EntityState state, ItemRemoved payload, StoredEvent event) {
        return state.toBuilder()
            .identifiers(without(state.getIdentifiers(), Set.of(payload.getItemId()), OwnedItem::getId))
            .build();
    }

    static EntityState contactMethodAdded(EntityState state, ContactMethodAdded payload, StoredEvent event) {
        return state.toBuilder()
            .contactMethods(upsert(state.getContactMethods(), List.of(payload.getContactMethod()), OwnedItem::getId))
            .build();
    }

    static EntityState contactMethodRemoved(EntityState state, ItemRemoved payload, StoredEvent event) {
        return state.toBuilder()
            .contactMethods(without(state.getContactMethods(), Set.of(payload.getItemId()), OwnedItem::getId))
            .build();
    }

    static EntityState affiliationAdded(EntityState state, AffiliationAdded payload, StoredEvent event) {
        return state.toBuilder()
            .affiliations(upsert(state.getAffiliations(), List.of(payload.getAffiliation()), OwnedItem::getId))
            .build();
    }

    static EntityState affiliationEnded(EntityState state, AffiliationEnded payload, StoredEvent event) {
        List<Affiliation> affiliations = new ArrayList<>();
        for (Affiliation affiliation : state.getAffiliations()) {
            if (affiliation.getId().equals(payload.getItemId()) && affiliation.isCurrent()) {
                affiliations.add(affiliation.toBuilder().endedOn(payload.getEndedOn()).build());
            } else {
                affiliations.add(affiliation);
            }
        }
        return state.toBuilder().affiliations(List.copyOf(affiliations)).build();
    }

    static EntityState affiliationsRepointed(EntityState state, AffiliationsRepointed payload, StoredEvent event) {
        Set<UUID> itemIds = new HashSet<>(payload.getItemIds());
        List<Affiliation> affiliations = new ArrayList<>();
        for (Affiliation affiliation : state.getAffiliations()) {
            if (itemIds.contains(affiliation.getId())) {
                affiliations.add(affiliation.toBuilder().organization(payload.getToOrganization()).build());
            } else {
                affiliations.add(affiliation);
            }
        }
        return state.toBuilder().affiliations(List.copyOf(affiliations)).build();
    }

    static EntityState provenanceRecorded(EntityState state, ProvenanceRecorded payload, StoredEvent event) {
        return state.toBuilder()
            .provenance(upsert(state.getProvenance(), List.of(payload.getRecord()), ProvenanceRecord::getId))
            .build();
    }

    static EntityState merged(EntityState state, EntityMerged payload, StoredEvent event) {
        if (payload.getRole() == MergeRole.ABSORBED) {
            return state.toBuilder()
                .status(EntityStatus.MERGED)
                .mergedInto(payload.getCounterpartId())
                .identifiers(List.of())
                .contactMethods(List.of())
                .affiliations(List.of())
                .provenance(List.of())
                .build();
        }

        List<UUID> absorbed = new ArrayList<>(state.getAbsorbedEntityIds());
        if (!absorbed.contains(payload.getCounterpartId())) {
            absorbed.add(payload.getCounterpartId());
        }
        return state.toBuilder()
            .fields(withChanges(state.getFields(), payload.getFieldOverrides(), List.of()))
            .identifiers(upsert(state.getIdentifiers(), payload.getIdentifiers(), OwnedItem::getId))
            .contactMethods(upsert(state.getContactMethods(), payload.getContactMethods(), OwnedItem::getId))
            .affiliations(upsert(state.getAffiliations(), payload.getAffiliations(), OwnedItem::getId))
            .provenance(upsert(state.getProvenance(), payload.getProvenance(), ProvenanceRecord::getId))
            .absorbedEntityIds(List.copyOf(absorbed))
            .build();
    }

    static EntityState split(EntityState state, EntitySplit payload, StoredEvent event) {
        Set<UUID> removedItems = new HashSet<>(payload.getRemovedItemIds());
        Set<UUID> released = new HashSet<>(payload.getReleasedEntityIds());
        if (payload.getAbsorbedEntityId() != null) {
            released.add(payload.getAbsorbedEntityId());
        }
        return state.toBuilder()
            .identifiers(without(state.getIdentifiers(), removedItems, OwnedItem::getId))
            .contactMethods(without(state.getContactMethods(), removedItems, OwnedItem::getId))
            .affiliations(without(state.getAffiliations(), removedItems, OwnedItem::getId))
            .provenance(without(state.getProvenance(), new HashSet<>(payload.getRemovedProvenanceIds()),
                ProvenanceRecord::getId))
            .absorbedEntityIds(without(state.getAbsorbedEntityIds(), released, Function.identity()))
            .build();
    }

    static EntityState deleted(EntityState state, EntityDeleted payload, StoredEvent event) {
        return state.toBuilder().status(EntityStatus.DELETED).build();
    }

    private static Map<String, String> withChanges(Map<String, String> current,
                                                   Map<String, String> set,
                                                   Collection<String> cleared) {
        TreeMap<String, String> fields = new TreeMap<>(current);
        set.forEach((name, value) -> {
            if (value == null) {
                fields.remove(name);
            } else {
                fields.put(name, value);
            }
        });
        cleared.forEach(fields::remove);
        return Collections.unmodifiableMap(fields);
    }

    private static <T> List<T> upsert(List<T> current, List<T> additions, Function<T, UUID> idOf) {
        List<T> result = new ArrayList<>(current);
        for (T addition : additions) {
            UUID id = idOf.apply(addition);
            int existing = -1;
            for (int i = 0; i < result.size(); i++) {
                if (idOf.apply(result.get(i)).equals(id)) {
                    existing = i;
                    break;
                }
            }
            if (existing >= 0) {
                result.set(existing, addition);
            } else {
                result.add(addition);
            }
        }
        return List.copyOf(result);
    }

    private static <T> List<T> without(List<T> current, Set<UUID> ids, Function<T, UUID> idOf) {
        return current.stream()
            .filter(item -> !ids.contains(idOf.apply(item)))
            .toList();
    }
}
