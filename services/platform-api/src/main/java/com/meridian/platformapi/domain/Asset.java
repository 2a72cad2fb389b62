package com.meridian.platformapi.domain;

import com.meridian.security.visibility.AssetAccessLevel;
import com.meridian.security.visibility.FieldSource;
import com.meridian.security.visibility.RowVisibility;
import java.time.Instant;

/**
 * A dataset published on the platform.
 *
 * @param username owner; null for assets imported without one
 */
public record Asset(
        long id,
        String name,
        String description,
        String username,
        AssetAccessLevel accessLevel,
        Instant createdAt) {

    /** Column view used when evaluating visibility filters. */
    public FieldSource fields() {
        return field ->
                switch (field) {
                    case RowVisibility.USERNAME -> username;
                    case RowVisibility.ACCESS_LEVEL -> accessLevel.value();
                    case "id" -> id;
                    case "name" -> name;
                    default -> null;
                };
    }

    public Asset withChanges(String newName, String newDescription, AssetAccessLevel newLevel) {
        return new Asset(
                id,
                newName != null ? newName : name,
                newDescription != null ? newDescription : description,
                username,
                newLevel != null ? newLevel : accessLevel,
                createdAt);
    }
}
