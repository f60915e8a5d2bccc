package dev.letterfinder.search;

import java.util.List;

import dev.letterfinder.archive.ArchiveItem;
import org.jspecify.annotations.Nullable;

/**
 * Normalized search hit: one catalog item of one archive with its ordered image URLs.
 *
 * <p>Archives are disjoint namespaces, so two records from different archives are never merged
 * even if their references coincide.
 *
 * @param archive   archive name, matching a configured archive client
 * @param reference catalog reference code ("Unknown" when the archive sent none)
 * @param title     item title ("Untitled" when absent)
 * @param date      free-text date as catalogued (empty when absent)
 * @param itemId    archive item identifier, or null
 * @param imageUrls ordered page image URLs (possibly empty)
 */
public record SearchRecord(
        String archive,
        String reference,
        String title,
        String date,
        @Nullable String itemId,
        List<String> imageUrls
) {

    static final String UNKNOWN_REFERENCE = "Unknown";
    static final String UNTITLED = "Untitled";

    public SearchRecord {
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
    }

    /**
     * Normalize a raw archive item, applying the defaults for missing fields.
     *
     * @param archive the archive the item came from
     * @param item    the raw item
     * @return a record with no null text fields
     */
    public static SearchRecord fromItem(String archive, ArchiveItem item) {
        return new SearchRecord(
                archive,
                orDefault(item.reference(), UNKNOWN_REFERENCE),
                orDefault(item.title(), UNTITLED),
                item.date() == null ? "" : item.date().trim(),
                item.id(),
                item.images());
    }

    /**
     * One-line location summary, e.g. {@code "LAC: MG30-E123 - Fairfax letters, Nov 1946"}.
     *
     * @param prefix archive label, or null for no label
     */
    public String summaryLine(@Nullable String prefix) {
        String line = reference + " - " + title + ", " + date;
        return prefix == null || prefix.isBlank() ? line : prefix + ": " + line;
    }

    private static String orDefault(@Nullable String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
