package dev.letterfinder.search;

import java.util.List;

/**
 * Accumulated outcome of one aggregation run.
 *
 * @param records       normalized records in accumulation order (archive order, then query order)
 * @param locations     one summary line per record, for the run report
 * @param failedQueries number of archive/query pairs that returned an error
 */
public record AggregatedSearch(List<SearchRecord> records, List<String> locations, int failedQueries) {

    public AggregatedSearch {
        records = records == null ? List.of() : List.copyOf(records);
        locations = locations == null ? List.of() : List.copyOf(locations);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
