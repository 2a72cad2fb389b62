package com.meridian.platformapi.api;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/** Body of {@code POST /api/v1/access-requests}. */
public record AccessRequestCreateRequest(@NotNull Long assetId, @Size(max = 2000) String description) {
}
