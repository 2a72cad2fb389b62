package com.meridian.platformapi.domain;

import com.meridian.security.visibility.RowFilter;
import java.util.List;
import java.util.Optional;

/**
 * Access request storage. Visibility filters may refer to the requested asset through
 * {@code asset.*} fields.
 */
public interface AccessRequestRepository {

    AccessRequest create(long assetId, String requesterUsername, String description);

    Optional<AccessRequest> findById(long id, RowFilter visibility);

    List<AccessRequest> findAll(RowFilter visibility, int offset, int limit);

    long count(RowFilter visibility);

    AccessRequest update(AccessRequest request);

    boolean deleteById(long id);

    int deleteByAssetId(long assetId);

    /** Whether {@code requester} holds an approved request for the asset. */
    boolean approvedRequestExists(String requester, long assetId);
}
