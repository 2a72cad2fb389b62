package com.meridian.platformapi.domain;

import java.time.Instant;

/**
 * A request by {@code requesterUsername} to use an asset it does not own.
 *
 * @param allowed null while pending, then the owner's (or an admin's) decision
 */
public record AccessRequest(
        long id,
        long assetId,
        String requesterUsername,
        String description,
        Boolean allowed,
        Instant createdAt,
        Instant validatedAt,
        String validatorUsername) {

    public AccessRequest decide(boolean decision, String validator, Instant at) {
        return new AccessRequest(
                id, assetId, requesterUsername, description, decision, createdAt, at, validator);
    }
}
