package com.meridian.security.visibility;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Who may see an asset.
 * <ul>
 *   <li>{@link #PUBLIC}: listed and readable by anyone</li>
 *   <li>{@link #VISIBLE}: listed for anyone, contents only for the owner or approved requesters</li>
 *   <li>{@link #PRIVATE}: owner only</li>
 * </ul>
 */
public enum AssetAccessLevel {

    PUBLIC("public"),
    PRIVATE("private"),
    VISIBLE("visible");

    private final String value;

    AssetAccessLevel(String value) {
        this.value = value;
    }

    /** Stored column value. */
    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Parses a stored value, ignoring case.
     *
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static AssetAccessLevel fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (AssetAccessLevel level : values()) {
                if (level.value.equals(normalized)) {
                    return level;
                }
            }
        }
        throw new IllegalArgumentException("Unknown asset access level: " + value);
    }
}
