package com.flagship.entity_store.event.payload;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.UUID;

/**
 * Appended to the survivor when a merge is reversed. The removed items now live on
 * the new entity.
 */
@Value
@Builder
@Jacksonized
public class EntitySplit implements EventPayload {

    UUID newEntityId;
    UUID candidateId;
    UUID absorbedEntityId;

    @Builder.Default
    List<UUID> removedItemIds = List.of();

    @Builder.Default
    List<UUID> removedProvenanceIds = List.of();

    /**
     * Entities merged into the absorbed identity that leave together with it.
     */
    @Builder.Default
    List<UUID> releasedEntityIds = List.of();
}
