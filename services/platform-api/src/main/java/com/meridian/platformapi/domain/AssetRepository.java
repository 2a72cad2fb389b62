package com.meridian.platformapi.domain;

import com.meridian.security.visibility.AssetAccessLevel;
import com.meridian.security.visibility.RowFilter;
import java.util.List;
import java.util.Optional;

/** Asset storage. Reads only return rows matching the given visibility filter. */
public interface AssetRepository {

    Asset create(String name, String description, String owner, AssetAccessLevel accessLevel);

    Optional<Asset> findById(long id, RowFilter visibility);

    List<Asset> findAll(RowFilter visibility, int offset, int limit);

    long count(RowFilter visibility);

    Asset update(Asset asset);

    boolean deleteById(long id);
}
