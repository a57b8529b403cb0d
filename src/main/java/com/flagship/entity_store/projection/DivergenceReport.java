package com.flagship.entity_store.projection;

import com.flagship.entity_store.entity.EntityRef;
import lombok.Value;

import java.util.List;

/**
 * Outcome of comparing a live materialized row with a replay of its full history.
 */
@Value
public class DivergenceReport {
    EntityRef ref;
    long liveVersion;
    long replayedVersion;
    List<String> differences;
    boolean repaired;

    public boolean isDiverged() {
        return !differences.isEmpty();
    }
}
