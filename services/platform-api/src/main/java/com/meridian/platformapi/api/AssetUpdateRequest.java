package com.meridian.platformapi.api;

import com.meridian.security.visibility.AssetAccessLevel;
import jakarta.validation.constraints.Size;

/** Body of {@code PATCH /api/v1/assets/{id}}. Null fields are left unchanged. */
public record AssetUpdateRequest(
        @Size(min = 1, max = 200) String name,
        @Size(max = 2000) String description,
        AssetAccessLevel accessLevel) {
}
