package com.meridian.platformapi.api;

/**
 * What the caller may do with one asset.
 *
 * @param readable contents may be read
 * @param mutable the asset may be updated or deleted
 * @param download objects of the asset may be downloaded
 * @param runWorkflow workflows may be started on the asset
 * @param approveRequests access requests for the asset may be decided
 */
public record AssetPermissions(
        long assetId,
        boolean readable,
        boolean mutable,
        boolean download,
        boolean runWorkflow,
        boolean approveRequests) {
}
