package dev.letterfinder.analysis;

import java.time.LocalDate;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Relevance verdict for one document's OCR text.
 *
 * @param mentionsChurchill a Churchill pattern matched
 * @param mentionsFairfax a Fairfax pattern matched
 * @param detectedDate first well-formed "D Month YYYY" date in the text, or null
 * @param likelyCorrespondence both parties mentioned and score at least {@link #LIKELY_THRESHOLD}
 * @param relevanceScore non-negative heuristic score
 */
public record Analysis(
    boolean mentionsChurchill,
    boolean mentionsFairfax,
    @Nullable LocalDate detectedDate,
    boolean likelyCorrespondence,
    int relevanceScore) {

  public static final int LIKELY_THRESHOLD = 20;

  public Analysis {
    if (relevanceScore < 0) {
      throw new IllegalArgumentException("relevanceScore must not be negative");
    }
    if (likelyCorrespondence && relevanceScore < LIKELY_THRESHOLD) {
      throw new IllegalArgumentException(
          "likely correspondence requires a score of at least " + LIKELY_THRESHOLD);
    }
  }

  public Optional<LocalDate> date() {
    return Optional.ofNullable(detectedDate);
  }
}
