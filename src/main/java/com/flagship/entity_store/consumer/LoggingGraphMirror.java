package com.flagship.entity_store.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.entity_store.entity.EntityRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Stand-in mirror used until a graph store is wired in. Logs what it would write.
 */
@Component
@Slf4j
public class LoggingGraphMirror implements GraphMirror {

    @Override
    public void createNode(EntityRef ref, JsonNode payload) {
        log.info("Graph mirror: create node {}", ref);
    }

    @Override
    public void updateNode(EntityRef ref, JsonNode changes) {
        log.info("Graph mirror: update node {} ({} changed)", ref, changes != null ? changes.size() : 0);
    }

    @Override
    public void mergeNodes(EntityRef survivor, EntityRef absorbed) {
        log.info("Graph mirror: merge node {} into {}", absorbed, survivor);
    }

    @Override
    public void splitNode(EntityRef survivor, EntityRef newEntity) {
        log.info("Graph mirror: split node {} off {}", newEntity, survivor);
    }

    @Override
    public void removeNode(EntityRef ref, boolean erased) {
        log.info("Graph mirror: remove node {} (erased={})", ref, erased);
    }
}
