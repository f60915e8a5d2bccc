package dev.letterfinder.archive;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * Top-level JSON response from an archive search endpoint: either {@code {"results": [...]}} or
 * {@code {"error": "..."}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArchiveSearchResponse(
        @Nullable String error,
        List<ArchiveItem> results
) {
    public ArchiveSearchResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
