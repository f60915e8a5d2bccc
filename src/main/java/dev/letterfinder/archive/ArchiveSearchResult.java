package dev.letterfinder.archive;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of one search call. A failed search carries an error message and no results; callers
 * check {@link #success()} instead of catching exceptions.
 */
public record ArchiveSearchResult(
        String archive,
        String query,
        List<ArchiveItem> results,
        @Nullable String error
) {
    public ArchiveSearchResult {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static ArchiveSearchResult succeeded(String archive, String query, List<ArchiveItem> results) {
        return new ArchiveSearchResult(archive, query, results, null);
    }

    public static ArchiveSearchResult failed(String archive, String query, String error) {
        return new ArchiveSearchResult(archive, query, List.of(), error);
    }

    public boolean success() {
        return error == null;
    }
}
