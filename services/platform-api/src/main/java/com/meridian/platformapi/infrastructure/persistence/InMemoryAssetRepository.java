package com.meridian.platformapi.infrastructure.persistence;

import com.meridian.platformapi.domain.Asset;
import com.meridian.platformapi.domain.AssetRepository;
import com.meridian.security.visibility.AssetAccessLevel;
import com.meridian.security.visibility.ExpressionRenderer;
import com.meridian.security.visibility.RowFilter;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/** Process-local {@link AssetRepository}, ordered by id. */
@Repository
public class InMemoryAssetRepository implements AssetRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAssetRepository.class);

    private final ConcurrentNavigableMap<Long, Asset> rows = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryAssetRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Asset create(String name, String description, String owner, AssetAccessLevel accessLevel) {
        long id = sequence.incrementAndGet();
        Asset asset = new Asset(id, name, description, owner, accessLevel, clock.instant());
        rows.put(id, asset);
        return asset;
    }

    @Override
    public Optional<Asset> findById(long id, RowFilter visibility) {
        return Optional.ofNullable(rows.get(id)).filter(asset -> visibility.test(asset.fields()));
    }

    @Override
    public List<Asset> findAll(RowFilter visibility, int offset, int limit) {
        if (log.isDebugEnabled()) {
            log.debug("Listing assets where {}", ExpressionRenderer.render(visibility));
        }
        return rows.values().stream()
                .filter(asset -> visibility.test(asset.fields()))
                .skip(offset)
                .limit(limit)
                .toList();
    }

    @Override
    public long count(RowFilter visibility) {
        return rows.values().stream().filter(asset -> visibility.test(asset.fields())).count();
    }

    @Override
    public Asset update(Asset asset) {
        if (rows.replace(asset.id(), asset) == null) {
            throw new IllegalStateException("Asset " + asset.id() + " does not exist");
        }
        return asset;
    }

    @Override
    public boolean deleteById(long id) {
        return rows.remove(id) != null;
    }
}
