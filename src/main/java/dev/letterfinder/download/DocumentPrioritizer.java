package dev.letterfinder.download;

import dev.letterfinder.search.SearchRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders search records so that items catalogued in late 1946 are downloaded first.
 *
 * <p>A record is in the target window when its free-text date contains {@code "1946"} and one of
 * the month tokens {@code Oct}, {@code Nov} or {@code Dec} (which also covers {@code October},
 * {@code November} and {@code December}). Matching is a case-sensitive substring test.
 */
public final class DocumentPrioritizer {

  private static final String TARGET_YEAR = "1946";
  private static final List<String> TARGET_MONTH_TOKENS = List.of("Oct", "Nov", "Dec");

  private DocumentPrioritizer() {
    // utility class
  }

  /**
   * Stable partition: window matches first, everything else after, original order kept within
   * each group.
   *
   * @param records records in accumulation order
   * @return a new list in download order
   */
  public static List<SearchRecord> prioritize(List<SearchRecord> records) {
    List<SearchRecord> ordered = new ArrayList<>(records);
    ordered.sort(Comparator.comparingInt(record -> isInTargetWindow(record.date()) ? 0 : 1));
    return ordered;
  }

  public static boolean isInTargetWindow(String date) {
    if (date == null || !date.contains(TARGET_YEAR)) {
      return false;
    }
    return TARGET_MONTH_TOKENS.stream().anyMatch(date::contains);
  }
}
