package com.meridian.security.visibility;

import java.util.Map;

/**
 * Read access to the named fields of one row, for in-memory evaluation of a
 * {@link RowFilter}. Dotted names such as {@code asset.username} address fields of a
 * related row.
 */
@FunctionalInterface
public interface FieldSource {

    /**
     * @return the field value, or null if the field is null or unknown
     */
    Object field(String name);

    static FieldSource of(Map<String, ?> fields) {
        return fields::get;
    }
}
