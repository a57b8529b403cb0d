package com.flagship.entity_store.entity.exception;

import com.flagship.entity_store.entity.EntityRef;
import lombok.Getter;

@Getter
public class EntityNotFoundException extends RuntimeException {

    private final String resource;

    public EntityNotFoundException(EntityRef ref) {
        super("Entity not found: " + ref);
        this.resource = ref.toString();
    }

    public EntityNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
        this.resource = resource;
    }
}
