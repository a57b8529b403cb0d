package com.flagship.entity_store.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.entity_store.entity.EntityRef;

/**
 * The graph store that mirrors entities and their relations. The entity store only
 * tells it what committed; it never reads back.
 */
public interface GraphMirror {

    void createNode(EntityRef ref, JsonNode payload);

    void updateNode(EntityRef ref, JsonNode changes);

    /**
     * Redirects the absorbed node's relations to the survivor.
     */
    void mergeNodes(EntityRef survivor, EntityRef absorbed);

    void splitNode(EntityRef survivor, EntityRef newEntity);

    /**
     * @param erased true for compliance erasure, where the node and every trace of it go
     */
    void removeNode(EntityRef ref, boolean erased);
}
