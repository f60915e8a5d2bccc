package dev.letterfinder.archive;

import org.jspecify.annotations.Nullable;

/** Outcome of an item-metadata lookup: the item, or the reason it could not be fetched. */
public record DocumentLookupResult(
        String archive,
        String documentId,
        @Nullable ArchiveItem item,
        @Nullable String error
) {
    public static DocumentLookupResult found(String archive, String documentId, ArchiveItem item) {
        return new DocumentLookupResult(archive, documentId, item, null);
    }

    public static DocumentLookupResult failed(String archive, String documentId, String error) {
        return new DocumentLookupResult(archive, documentId, null, error);
    }

    public boolean success() {
        return error == null && item != null;
    }
}
