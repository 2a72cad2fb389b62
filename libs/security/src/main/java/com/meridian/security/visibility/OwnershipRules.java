package com.meridian.security.visibility;

import com.meridian.security.identity.Identity;

/**
 * Decisions about a single, already loaded row that depend on who owns it.
 */
public final class OwnershipRules {

    private OwnershipRules() {
        // utility class
    }

    /**
     * Only admins and the owner of the requested asset may approve or reject an access
     * request for it.
     */
    public static boolean canApproveAccessRequest(Identity identity, String assetOwner) {
        if (identity == null) {
            return false;
        }
        return identity.isAdmin() || isOwner(identity, assetOwner);
    }

    /**
     * Workflows may run on an asset for admins, its owner, anyone when it is public, and
     * callers holding an approved access request for it.
     */
    public static boolean canRunWorkflowOnAsset(
            Identity identity, String assetOwner, AssetAccessLevel level, boolean approvedRequestExists) {
        if (identity == null) {
            return false;
        }
        return identity.isAdmin()
                || isOwner(identity, assetOwner)
                || level == AssetAccessLevel.PUBLIC
                || approvedRequestExists;
    }

    /**
     * Object contents may be downloaded by anyone when the asset is public; otherwise by
     * admins, the owner, and callers holding an approved access request.
     */
    public static boolean canDownloadAssetObject(
            Identity identity, String assetOwner, AssetAccessLevel level, boolean approvedRequestExists) {
        if (level == AssetAccessLevel.PUBLIC) {
            return true;
        }
        if (identity == null) {
            return false;
        }
        return identity.isAdmin() || isOwner(identity, assetOwner) || approvedRequestExists;
    }

    private static boolean isOwner(Identity identity, String owner) {
        return owner != null && owner.equals(identity.username());
    }
}
