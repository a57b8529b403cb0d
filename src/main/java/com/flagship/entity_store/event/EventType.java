package com.flagship.entity_store.event;

import com.flagship.entity_store.event.payload.AffiliationAdded;
import com.flagship.entity_store.event.payload.AffiliationEnded;
import com.flagship.entity_store.event.payload.AffiliationsRepointed;
import com.flagship.entity_store.event.payload.ContactMethodAdded;
import com.flagship.entity_store.event.payload.EntityCreated;
import com.flagship.entity_store.event.payload.EntityDeleted;
import com.flagship.entity_store.event.payload.EntityMerged;
import com.flagship.entity_store.event.payload.EntitySplit;
import com.flagship.entity_store.event.payload.EventPayload;
import com.flagship.entity_store.event.payload.FieldsUpdated;
import com.flagship.entity_store.event.payload.IdentifierAdded;
import com.flagship.entity_store.event.payload.ItemRemoved;
import com.flagship.entity_store.event.payload.ProvenanceRecorded;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed catalog of event types.
 *
 * The wire name is what the event log stores. Replay may meet wire names that are not
 * in this catalog (written by a newer release); see {@link #fromWireName(String)}.
 */
public enum EventType {
    CREATED("Created", EntityCreated.class, true, false),
    UPDATED("Updated", FieldsUpdated.class, true, false),
    IDENTIFIER_ADDED("IdentifierAdded", IdentifierAdded.class, false, false),
    IDENTIFIER_REMOVED("IdentifierRemoved", ItemRemoved.class, false, false),
    CONTACT_METHOD_ADDED("ContactMethodAdded", ContactMethodAdded.class, false, false),
    CONTACT_METHOD_REMOVED("ContactMethodRemoved", ItemRemoved.class, false, false),
    AFFILIATION_ADDED("AffiliationAdded", AffiliationAdded.class, false, false),
    AFFILIATION_ENDED("AffiliationEnded", AffiliationEnded.class, false, false),
    AFFILIATIONS_REPOINTED("AffiliationsRepointed", AffiliationsRepointed.class, false, true),
    PROVENANCE_RECORDED("ProvenanceRecorded", ProvenanceRecorded.class, false, false),
    MERGED("Merged", EntityMerged.class, true, true),
    SPLIT("Split", EntitySplit.class, true, true),
    DELETED("Deleted", EntityDeleted.class, true, false);

    private final String wireName;
    private final Class<? extends EventPayload> payloadType;
    private final boolean mirrored;
    private final boolean coordinated;

    EventType(String wireName, Class<? extends EventPayload> payloadType, boolean mirrored, boolean coordinated) {
        this.wireName = wireName;
        this.payloadType = payloadType;
        this.mirrored = mirrored;
        this.coordinated = coordinated;
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    /**
     * Whether committed events of this type are relayed to the graph mirror.
     */
    public boolean isMirrored() {
        return mirrored;
    }

    /**
     * Whether only the merge/split coordinator may append this type.
     */
    public boolean isCoordinated() {
        return coordinated;
    }

    /**
     * Looks up a wire name. Empty for types this release does not know.
     */
    public static Optional<EventType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}
