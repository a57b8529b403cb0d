package com.flagship.entity_store.compliance;

import com.flagship.entity_store.entity.EntityRef;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit entry for one compliance erasure. Holds counts and who asked, never any of the
 * erased payload.
 */
@Value
public class ErasureRecord {
    UUID id;
    EntityRef ref;
    int eventsDeleted;
    int snapshotsDeleted;
    String requestedBy;
    String reason;
    Instant erasedAt;
}
