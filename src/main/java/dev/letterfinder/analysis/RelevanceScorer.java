package dev.letterfinder.analysis;

import dev.letterfinder.ocr.OcrDocument;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores OCR text against the profile of the target letter: Churchill and Fairfax mentions and a
 * date in October to December 1946.
 *
 * <p>Scoring is a pure function of the text:
 *
 * <ul>
 *   <li>+10 when any Churchill pattern matches (once, however many patterns match)
 *   <li>+10 when any Fairfax pattern matches (once)
 *   <li>+30 when the first "D Month YYYY" date names October, November or December 1946
 * </ul>
 *
 * <p>The detected date is only reported when it is a real calendar day.
 */
@Component
public class RelevanceScorer {

  private static final Logger log = LoggerFactory.getLogger(RelevanceScorer.class);

  static final int ENTITY_BONUS = 10;
  static final int DATE_WINDOW_BONUS = 30;

  /** Score above which a likely letter is reported as a potential match. */
  static final int POTENTIAL_MATCH_SCORE = 30;

  private static final int TARGET_YEAR = 1946;

  private static final List<Pattern> CHURCHILL_PATTERNS =
      List.of(
          Pattern.compile("\\bchurchill\\b", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\bwinston\\b", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\bprime\\s+minister\\b", Pattern.CASE_INSENSITIVE));

  private static final List<Pattern> FAIRFAX_PATTERNS =
      List.of(
          Pattern.compile("\\bfairfax\\b", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\bbryan\\b", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\bcolonel\\b", Pattern.CASE_INSENSITIVE));

  private static final Pattern DATE_PATTERN =
      Pattern.compile(
          "(\\d{1,2})\\s+(January|February|March|April|May|June|July|August|September"
              + "|October|November|December)\\s+(\\d{4})");

  /**
   * Analyze raw OCR text.
   *
   * @param text concatenated page text, may be empty
   * @return the analysis
   */
  public Analysis analyze(String text) {
    String content = text == null ? "" : text;
    int score = 0;

    boolean churchill = anyMatches(CHURCHILL_PATTERNS, content);
    if (churchill) {
      score += ENTITY_BONUS;
    }
    boolean fairfax = anyMatches(FAIRFAX_PATTERNS, content);
    if (fairfax) {
      score += ENTITY_BONUS;
    }

    @Nullable LocalDate date = null;
    Matcher matcher = DATE_PATTERN.matcher(content);
    if (matcher.find()) {
      if (isInTargetWindow(matcher)) {
        score += DATE_WINDOW_BONUS;
      }
      date = toDate(matcher);
    }

    boolean likely = churchill && fairfax && score >= Analysis.LIKELY_THRESHOLD;
    return new Analysis(churchill, fairfax, date, likely, score);
  }

  /**
   * Analyze the combined text of an OCR'd document.
   *
   * @param document document with page texts
   * @return the document paired with its analysis
   */
  public AnalyzedDocument analyze(OcrDocument document) {
    Analysis analysis = analyze(document.fullText());
    if (analysis.likelyCorrespondence() && analysis.relevanceScore() > POTENTIAL_MATCH_SCORE) {
      log.info(
          "Potential match found: {} (score: {})",
          document.document().reference(),
          analysis.relevanceScore());
    }
    return new AnalyzedDocument(document, analysis);
  }

  private static boolean anyMatches(List<Pattern> patterns, String text) {
    for (Pattern pattern : patterns) {
      if (pattern.matcher(text).find()) {
        return true;
      }
    }
    return false;
  }

  // Month and year alone decide the window, so an impossible day such as 31 November still counts.
  private static boolean isInTargetWindow(Matcher dateMatch) {
    Month month = Month.valueOf(dateMatch.group(2).toUpperCase(Locale.ROOT));
    return Integer.parseInt(dateMatch.group(3)) == TARGET_YEAR
        && month.getValue() >= Month.OCTOBER.getValue();
  }

  private static @Nullable LocalDate toDate(Matcher dateMatch) {
    try {
      int day = Integer.parseInt(dateMatch.group(1));
      Month month = Month.valueOf(dateMatch.group(2).toUpperCase(Locale.ROOT));
      int year = Integer.parseInt(dateMatch.group(3));
      return LocalDate.of(year, month, day);
    } catch (DateTimeException e) {
      log.debug("Ignoring impossible date '{}': {}", dateMatch.group(), e.getMessage());
      return null;
    }
  }
}
