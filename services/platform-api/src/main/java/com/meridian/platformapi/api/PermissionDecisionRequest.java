package com.meridian.platformapi.api;

import jakarta.validation.constraints.NotNull;

/** Body of {@code POST /api/v1/access-requests/{id}/permission}. */
public record PermissionDecisionRequest(@NotNull Boolean allowed) {
}
