package com.flagship.entity_store.event;

import lombok.Value;

import java.time.Instant;

/**
 * A sequence slot handed out to one append, with the timestamp the event will carry.
 */
@Value
public class SequenceAllocation {
    long sequence;
    Instant occurredAt;
}
