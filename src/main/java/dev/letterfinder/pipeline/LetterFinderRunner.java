package dev.letterfinder.pipeline;

import dev.letterfinder.analysis.ExtractedLetter;
import dev.letterfinder.analysis.LetterField;
import dev.letterfinder.config.LetterFinderProperties;
import dev.letterfinder.search.SearchWindow;
import java.nio.file.Path;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point. Options:
 *
 * <ul>
 *   <li>{@code --query=TEXT} additional search terms
 *   <li>{@code --period="YYYY-MM to YYYY-MM"} search window, defaults to the configured one
 *   <li>{@code --full} run search, download, OCR and extraction
 *   <li>{@code --ocr-only=DIR} OCR previously downloaded documents only
 *   <li>{@code --max-docs=N} documents to download with {@code --full}
 * </ul>
 *
 * <p>Without {@code --full} or {@code --ocr-only} only the archive search runs. Outcomes are
 * logged; no exit code is set.
 */
@Component
@ConditionalOnProperty(
    prefix = "letterfinder.runner",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class LetterFinderRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(LetterFinderRunner.class);

  private static final String RULE = "=".repeat(80);
  private static final int MATCH_EXCERPT = 150;
  private static final int LETTER_EXCERPT = 100;

  private final LetterSearchPipeline pipeline;
  private final LetterFinderProperties properties;

  public LetterFinderRunner(LetterSearchPipeline pipeline, LetterFinderProperties properties) {
    this.pipeline = pipeline;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    log.info(RULE);
    log.info("FAIRFAX LETTER FINDER");
    log.info("Searching for the original letter from Colonel Bryan Charles Fairfax, C.M.G.");
    log.info("to Winston Churchill (likely written November 1946)");
    log.info(RULE);

    String ocrOnly = option(args, "ocr-only");
    if (ocrOnly != null) {
      reportOcrOnly(pipeline.processDirectory(Path.of(ocrOnly)));
      return;
    }

    String query = option(args, "query");
    SearchWindow window = resolveWindow(option(args, "period"));
    if (args.containsOption("full")) {
      log.info("Executing full search pipeline including OCR processing");
      int maxDocs = resolveMaxDocs(option(args, "max-docs"));
      reportFullSearch(pipeline.executeFullSearch(query, window, maxDocs));
    } else {
      reportSearchOnly(pipeline.searchOnly(query, window));
    }
  }

  SearchWindow resolveWindow(@Nullable String period) {
    if (period == null) {
      return pipeline.defaultWindow();
    }
    return SearchWindow.parsePeriod(period)
        .orElseGet(
            () -> {
              SearchWindow fallback = pipeline.defaultWindow();
              log.warn(
                  "Ignoring malformed period '{}', expected 'YYYY-MM to YYYY-MM'; using {} to {}",
                  period,
                  fallback.start(),
                  fallback.end());
              return fallback;
            });
  }

  int resolveMaxDocs(@Nullable String value) {
    int fallback = properties.download().defaultMaxDocs();
    if (value == null) {
      return fallback;
    }
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed < 1) {
        log.warn("--max-docs must be positive, got {}; using {}", parsed, fallback);
        return fallback;
      }
      return parsed;
    } catch (NumberFormatException e) {
      log.warn("--max-docs is not a number: '{}'; using {}", value, fallback);
      return fallback;
    }
  }

  private static @Nullable String option(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return null;
    }
    String value = values.get(values.size() - 1);
    return value == null || value.isBlank() ? null : value;
  }

  private void reportSearchOnly(PipelineResult result) {
    log.info(RULE);
    log.info("SEARCH RESULTS SUMMARY");
    log.info(RULE);
    log.info("Search status: {} ({} records)", result.status(), result.searchResultCount());

    log.info("Most likely locations for Fairfax's original letter:");
    logNumbered(result.locations());
    log.info("Possible letter topics:");
    logNumbered(result.plan().likelyTopics());
    log.info("Next steps for archival research:");
    logNumbered(result.plan().searchStrategy());
    log.info("OCR processing capabilities:");
    logNumbered(result.plan().ocrProcess());
    log.info("To execute full search with OCR processing, run with --full");
  }

  private void reportFullSearch(PipelineResult result) {
    log.info(RULE);
    log.info("FULL SEARCH RESULTS");
    log.info(RULE);
    log.info("Search status: {}", result.status());
    if (result.reason() != null) {
      log.info("Reason: {}", result.reason());
    }
    log.info("Documents found: {}", result.searchResultCount());
    log.info("Documents processed with OCR: {}", result.documentsProcessed());
    log.info("Potential letter matches: {}", result.lettersFound());

    int i = 1;
    for (ExtractedLetter match : result.topMatches()) {
      log.info("Match {} (Score: {})", i++, match.relevanceScore());
      log.info("Archive: {}", match.archive());
      log.info("Reference: {}", match.reference());
      log.info("Title: {}", match.title());
      log.info("Date: {}", match.date());
      match.field(LetterField.SALUTATION).ifPresent(s -> log.info("Salutation: {}", s));
      match
          .field(LetterField.BODY)
          .ifPresent(body -> log.info("Body excerpt: {}", excerpt(body, MATCH_EXCERPT)));
    }
    if (result.status() == PipelineStatus.SUCCESS) {
      log.info("Found {} potential matches for the Fairfax letter", result.lettersFound());
    } else {
      log.info("No definitive match found for the Fairfax letter");
      log.info("Next steps for archival research:");
      logNumbered(result.plan().searchStrategy());
    }
  }

  private void reportOcrOnly(PipelineResult result) {
    log.info(RULE);
    log.info("OCR PROCESSING RESULTS");
    log.info(RULE);
    if (result.status() == PipelineStatus.FAILURE) {
      log.error("OCR run failed: {}", result.reason());
      return;
    }
    log.info("Processed {} documents", result.documentsProcessed());
    log.info("Found {} potential letter matches", result.lettersFound());

    int i = 1;
    for (ExtractedLetter letter : result.topMatches()) {
      log.info("Potential Letter {} (Score: {})", i++, letter.relevanceScore());
      log.info("Archive: {}", letter.archive());
      log.info("Reference: {}", letter.reference());
      letter.field(LetterField.DATE).ifPresent(d -> log.info("Date: {}", d));
      letter.field(LetterField.SALUTATION).ifPresent(s -> log.info("Salutation: {}", s));
      letter
          .field(LetterField.BODY)
          .ifPresent(body -> log.info("Body excerpt: {}", excerpt(body, LETTER_EXCERPT)));
    }
  }

  private static void logNumbered(List<String> lines) {
    for (int i = 0; i < lines.size(); i++) {
      log.info("{}. {}", i + 1, lines.get(i));
    }
  }

  static String excerpt(String text, int max) {
    return text.length() > max ? text.substring(0, max) + "..." : text;
  }
}
