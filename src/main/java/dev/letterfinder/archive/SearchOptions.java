package dev.letterfinder.archive;

import java.time.LocalDate;

import org.jspecify.annotations.Nullable;

/**
 * Paging and filter options for an archive search.
 *
 * <p>The date range is only sent when both ends are present. The collection is passed through to
 * the archive; results are never filtered client-side.
 *
 * @param page 1-based page number
 * @param limit maximum results per page
 * @param startDate inclusive start of the date range, or null
 * @param endDate inclusive end of the date range, or null
 * @param collection collection identifier constraint, or null
 */
public record SearchOptions(
        int page,
        int limit,
        @Nullable LocalDate startDate,
        @Nullable LocalDate endDate,
        @Nullable String collection
) {

    private static final int DEFAULT_PAGE = 1;
    private static final int DEFAULT_LIMIT = 20;

    public SearchOptions {
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
    }

    /** First page of 20 results, no date range, no collection. */
    public static SearchOptions defaults() {
        return new SearchOptions(DEFAULT_PAGE, DEFAULT_LIMIT, null, null, null);
    }

    public SearchOptions withLimit(int newLimit) {
        return new SearchOptions(page, newLimit, startDate, endDate, collection);
    }

    public SearchOptions withDateRange(LocalDate start, LocalDate end) {
        return new SearchOptions(page, limit, start, end, collection);
    }

    public SearchOptions withCollection(@Nullable String newCollection) {
        return new SearchOptions(page, limit, startDate, endDate, newCollection);
    }

    public boolean hasDateRange() {
        return startDate != null && endDate != null;
    }
}
