package com.meridian.security.visibility;

import com.meridian.security.identity.Identity;

import java.util.List;

/**
 * Row-level visibility predicates, to be combined with the storage query before any row
 * is read. Admins see everything. A {@code null} identity stands for an anonymous caller.
 * <p>
 * Visibility complements {@link Identity#enforceOrDeny}; callers apply both.
 */
public final class RowVisibility {

    public static final String USERNAME = "username";
    public static final String ACCESS_LEVEL = "access_level";
    public static final String ASSET_USERNAME = "asset.username";
    public static final String ASSET_ACCESS_LEVEL = "asset.access_level";
    public static final String REQUESTER_USERNAME = "requester_username";
    public static final String CREATOR_USERNAME = "creator_username";

    private static final List<String> LISTED_LEVELS =
            List.of(AssetAccessLevel.PUBLIC.value(), AssetAccessLevel.VISIBLE.value());

    private RowVisibility() {
        // utility class
    }

    /** Assets that show up in listings and search: public or visible ones, plus the caller's own. */
    public static RowFilter assetsVisible(Identity identity) {
        return listedOrOwned(identity, ACCESS_LEVEL, USERNAME);
    }

    /** Assets whose contents may be read: public ones, plus the caller's own. */
    public static RowFilter assetsReadable(Identity identity) {
        return publicOrOwned(identity, ACCESS_LEVEL, USERNAME);
    }

    /** Assets the caller may change or delete: its own. */
    public static RowFilter assetsMutable(Identity identity) {
        return ownedBy(identity, USERNAME);
    }

    /** Asset objects, by the visibility of their parent asset. */
    public static RowFilter assetObjectsVisible(Identity identity) {
        return listedOrOwned(identity, ASSET_ACCESS_LEVEL, ASSET_USERNAME);
    }

    /** Access requests the caller filed, or that target one of its assets. */
    public static RowFilter accessRequests(Identity identity) {
        if (identity == null) {
            return RowFilter.none();
        }
        if (identity.isAdmin()) {
            return RowFilter.all();
        }
        return RowFilter.anyOf(
                RowFilter.equalTo(REQUESTER_USERNAME, identity.username()),
                RowFilter.equalTo(ASSET_USERNAME, identity.username()));
    }

    /** Workflow jobs the caller created. */
    public static RowFilter workflowJobs(Identity identity) {
        return ownedBy(identity, CREATOR_USERNAME);
    }

    /** User metadata records of the caller. */
    public static RowFilter userMeta(Identity identity) {
        return ownedBy(identity, USERNAME);
    }

    /**
     * Rows not owned by the caller, ownerless rows included. Used to hide a caller's own
     * assets from recommendations. Applies to admins too.
     */
    public static RowFilter excludeOwnedBy(Identity identity) {
        if (identity == null) {
            return RowFilter.all();
        }
        return RowFilter.anyOf(
                RowFilter.not(RowFilter.equalTo(USERNAME, identity.username())),
                RowFilter.equalTo(USERNAME, null));
    }

    private static RowFilter listedOrOwned(Identity identity, String levelField, String ownerField) {
        RowFilter listed = RowFilter.in(levelField, LISTED_LEVELS);
        return orOwned(identity, listed, ownerField);
    }

    private static RowFilter publicOrOwned(Identity identity, String levelField, String ownerField) {
        RowFilter open = RowFilter.equalTo(levelField, AssetAccessLevel.PUBLIC.value());
        return orOwned(identity, open, ownerField);
    }

    private static RowFilter orOwned(Identity identity, RowFilter open, String ownerField) {
        if (identity == null) {
            return open;
        }
        if (identity.isAdmin()) {
            return RowFilter.all();
        }
        return RowFilter.anyOf(open, RowFilter.equalTo(ownerField, identity.username()));
    }

    private static RowFilter ownedBy(Identity identity, String ownerField) {
        if (identity == null) {
            return RowFilter.none();
        }
        if (identity.isAdmin()) {
            return RowFilter.all();
        }
        return RowFilter.equalTo(ownerField, identity.username());
    }
}
