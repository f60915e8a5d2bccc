package dev.letterfinder.archive;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * One catalog item as returned by an archive's search or item endpoint. Every field is optional on
 * the wire; defaults are applied when the item is turned into a search record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArchiveItem(
        @Nullable String reference,
        @Nullable String title,
        @Nullable String date,
        @Nullable String id,
        List<String> images
) {
    public ArchiveItem {
        images = images == null ? List.of() : images.stream().filter(Objects::nonNull).toList();
    }
}
