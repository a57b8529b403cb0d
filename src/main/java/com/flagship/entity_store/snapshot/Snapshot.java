package com.flagship.entity_store.snapshot;

import com.flagship.entity_store.entity.EntityRef;
import com.flagship.entity_store.entity.EntityState;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Advisory checkpoint: the projected state as of a committed event.
 *
 * asOfOccurredAt is the timestamp of that event, which is what point-in-time reads
 * select snapshots by; takenAt is only when the checkpoint was written.
 */
@Value
public class Snapshot {
    UUID id;
    EntityRef ref;
    long asOfSequence;
    Instant asOfOccurredAt;
    EntityState state;
    Instant takenAt;
}
