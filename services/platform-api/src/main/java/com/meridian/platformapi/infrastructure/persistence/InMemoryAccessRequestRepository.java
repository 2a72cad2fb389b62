package com.meridian.platformapi.infrastructure.persistence;

import com.meridian.platformapi.domain.AccessRequest;
import com.meridian.platformapi.domain.AccessRequestRepository;
import com.meridian.platformapi.domain.Asset;
import com.meridian.platformapi.domain.AssetRepository;
import com.meridian.security.visibility.ExpressionRenderer;
import com.meridian.security.visibility.FieldSource;
import com.meridian.security.visibility.RowFilter;
import com.meridian.security.visibility.RowVisibility;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Process-local {@link AccessRequestRepository}. The {@code asset.*} fields of a request are
 * read from the asset store at evaluation time.
 */
@Repository
public class InMemoryAccessRequestRepository implements AccessRequestRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAccessRequestRepository.class);

    private final ConcurrentNavigableMap<Long, AccessRequest> rows = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AssetRepository assets;
    private final Clock clock;

    public InMemoryAccessRequestRepository(AssetRepository assets, Clock clock) {
        this.assets = assets;
        this.clock = clock;
    }

    @Override
    public AccessRequest create(long assetId, String requesterUsername, String description) {
        long id = sequence.incrementAndGet();
        AccessRequest request =
                new AccessRequest(id, assetId, requesterUsername, description, null, clock.instant(), null, null);
        rows.put(id, request);
        return request;
    }

    @Override
    public Optional<AccessRequest> findById(long id, RowFilter visibility) {
        return Optional.ofNullable(rows.get(id)).filter(request -> visibility.test(fieldsOf(request)));
    }

    @Override
    public List<AccessRequest> findAll(RowFilter visibility, int offset, int limit) {
        if (log.isDebugEnabled()) {
            log.debug("Listing access requests where {}", ExpressionRenderer.render(visibility));
        }
        return rows.values().stream()
                .filter(request -> visibility.test(fieldsOf(request)))
                .skip(offset)
                .limit(limit)
                .toList();
    }

    @Override
    public long count(RowFilter visibility) {
        return rows.values().stream().filter(request -> visibility.test(fieldsOf(request))).count();
    }

    @Override
    public AccessRequest update(AccessRequest request) {
        if (rows.replace(request.id(), request) == null) {
            throw new IllegalStateException("Access request " + request.id() + " does not exist");
        }
        return request;
    }

    @Override
    public boolean deleteById(long id) {
        return rows.remove(id) != null;
    }

    @Override
    public int deleteByAssetId(long assetId) {
        List<Long> ids =
                rows.values().stream().filter(r -> r.assetId() == assetId).map(AccessRequest::id).toList();
        ids.forEach(rows::remove);
        return ids.size();
    }

    @Override
    public boolean approvedRequestExists(String requester, long assetId) {
        return rows.values().stream()
                .anyMatch(r -> r.assetId() == assetId
                        && r.requesterUsername().equals(requester)
                        && Boolean.TRUE.equals(r.allowed()));
    }

    private FieldSource fieldsOf(AccessRequest request) {
        Optional<Asset> asset = assets.findById(request.assetId(), RowFilter.all());
        return field ->
                switch (field) {
                    case RowVisibility.REQUESTER_USERNAME -> request.requesterUsername();
                    case RowVisibility.ASSET_USERNAME -> asset.map(Asset::username).orElse(null);
                    case RowVisibility.ASSET_ACCESS_LEVEL -> asset.map(a -> a.accessLevel().value()).orElse(null);
                    case "asset_id" -> request.assetId();
                    default -> null;
                };
    }
}
