package com.meridian.platformapi.api;

import com.meridian.security.visibility.AssetAccessLevel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/v1/assets}.
 *
 * @param accessLevel defaults to {@link AssetAccessLevel#PRIVATE}
 */
public record AssetCreateRequest(
        @NotBlank @Size(max = 200) String name,
        @Size(max = 2000) String description,
        AssetAccessLevel accessLevel) {
}
