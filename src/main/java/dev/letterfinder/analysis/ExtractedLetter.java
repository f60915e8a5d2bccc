package dev.letterfinder.analysis;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Letter candidate segmented from a likely-correspondence document, for human review.
 *
 * @param archive archive of the source document
 * @param reference catalog reference of the source document
 * @param title catalogue title
 * @param date catalogue date (free text)
 * @param fields recognised letter parts, at least two of them
 * @param relevanceScore score of the source document's analysis
 * @param fullText concatenated OCR text of all pages
 */
public record ExtractedLetter(
    String archive,
    String reference,
    String title,
    String date,
    Map<LetterField, String> fields,
    int relevanceScore,
    String fullText) {

  public ExtractedLetter {
    EnumMap<LetterField, String> copy = new EnumMap<>(LetterField.class);
    if (fields != null) {
      copy.putAll(fields);
    }
    fields = Collections.unmodifiableMap(copy);
  }

  public Optional<String> field(LetterField field) {
    return Optional.ofNullable(fields.get(field));
  }
}
