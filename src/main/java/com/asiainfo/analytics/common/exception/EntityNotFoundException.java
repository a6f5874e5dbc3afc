package com.asiainfo.analytics.common.exception;

public class EntityNotFoundException extends RuntimeException {

    public EntityNotFoundException(String entityKind, String id) {
        super(entityKind + " not found: " + id);
    }
}
