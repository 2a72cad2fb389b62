package com.meridian.platformapi.domain;

/**
 * Thrown when an entity does not exist or is not visible to the caller. The two cases are
 * not distinguished.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String entity, long id) {
        super("%s %d not found".formatted(entity, id));
    }
}
