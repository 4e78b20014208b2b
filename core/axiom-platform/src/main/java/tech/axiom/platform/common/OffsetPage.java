package tech.axiom.platform.common;

import java.util.List;

/**
 * Generic page record for offset-based pagination.
 *
 * @param <T> The type of items in the page
 * @param items The items on this page
 * @param total Total number of items matching the filter (all pages)
 * @param offset The offset used for this page
 * @param limit The page size limit
 */
public record OffsetPage<T>(
    List<T> items,
    long total,
    int offset,
    int limit
) {}
