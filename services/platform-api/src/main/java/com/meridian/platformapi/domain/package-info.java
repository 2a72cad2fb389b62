/**
 * Domain records and storage ports of the platform API.
 *
 * <p>Repositories take a {@link com.meridian.security.visibility.RowFilter} on every read so
 * the caller's row-level visibility is applied by storage, before rows reach a controller.
 */
package com.meridian.platformapi.domain;
