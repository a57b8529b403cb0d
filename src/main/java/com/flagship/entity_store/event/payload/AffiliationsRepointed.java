package com.flagship.entity_store.event.payload;

import com.flagship.entity_store.entity.EntityRef;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.UUID;

/**
 * Moves affiliation links from one organization to another when that organization is
 * merged away, or back to the recreated organization when the merge is split.
 * The items keep their ids, dates and provenance.
 */
@Value
@Builder
@Jacksonized
public class AffiliationsRepointed implements EventPayload {

    EntityRef fromOrganization;
    EntityRef toOrganization;
    UUID candidateId;

    @Builder.Default
    List<UUID> itemIds = List.of();
}
