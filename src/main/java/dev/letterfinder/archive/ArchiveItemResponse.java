package dev.letterfinder.archive;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * JSON response from an archive item endpoint: the item's own fields, or a single {@code error}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArchiveItemResponse(
        @Nullable String error,
        @Nullable String reference,
        @Nullable String title,
        @Nullable String date,
        @Nullable String id,
        @Nullable List<String> images
) {
    public ArchiveItem toItem() {
        return new ArchiveItem(reference, title, date, id, images);
    }
}
