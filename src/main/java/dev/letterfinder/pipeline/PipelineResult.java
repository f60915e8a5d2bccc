package dev.letterfinder.pipeline;

import dev.letterfinder.analysis.ExtractedLetter;
import dev.letterfinder.search.AggregatedSearch;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Best-effort summary of a pipeline run. Always produced; stage failures show up in the status
 * and reason rather than as exceptions.
 *
 * @param status overall outcome
 * @param reason why the run stopped early or found nothing, null on success
 * @param searchResultCount records found across all archives
 * @param documentsProcessed documents that went through OCR
 * @param lettersFound number of extracted letter candidates
 * @param topMatches up to {@link #TOP_MATCHES} best candidates, highest score first
 * @param locations summary line per search record
 * @param plan research guidance for follow-up
 */
public record PipelineResult(
    PipelineStatus status,
    @Nullable String reason,
    int searchResultCount,
    int documentsProcessed,
    int lettersFound,
    List<ExtractedLetter> topMatches,
    List<String> locations,
    ResearchPlan plan) {

  public static final int TOP_MATCHES = 3;

  public PipelineResult {
    if (status == null) {
      throw new IllegalArgumentException("status is required");
    }
    topMatches = topMatches == null ? List.of() : List.copyOf(topMatches);
    locations = locations == null ? List.of() : List.copyOf(locations);
  }

  static PipelineResult noSearchResults(ResearchPlan plan) {
    return new PipelineResult(
        PipelineStatus.FAILURE, "No search results found", 0, 0, 0, List.of(), List.of(), plan);
  }

  static PipelineResult searchCompleted(AggregatedSearch search, ResearchPlan plan) {
    if (search.isEmpty()) {
      return noSearchResults(plan);
    }
    return new PipelineResult(
        PipelineStatus.PARTIAL,
        "Search only, no documents processed",
        search.records().size(),
        0,
        0,
        List.of(),
        search.locations(),
        plan);
  }

  static PipelineResult noDownloads(AggregatedSearch search, ResearchPlan plan) {
    return new PipelineResult(
        PipelineStatus.PARTIAL,
        "No documents could be downloaded",
        search.records().size(),
        0,
        0,
        List.of(),
        search.locations(),
        plan);
  }

  static PipelineResult processed(
      int searchResultCount,
      int documentsProcessed,
      List<ExtractedLetter> letters,
      List<String> locations,
      ResearchPlan plan) {
    boolean found = !letters.isEmpty();
    return new PipelineResult(
        found ? PipelineStatus.SUCCESS : PipelineStatus.PARTIAL,
        found ? null : "No letter candidates extracted",
        searchResultCount,
        documentsProcessed,
        letters.size(),
        letters.subList(0, Math.min(TOP_MATCHES, letters.size())),
        locations,
        plan);
  }

  static PipelineResult nothingToProcess(String reason, ResearchPlan plan) {
    return new PipelineResult(
        PipelineStatus.FAILURE, reason, 0, 0, 0, List.of(), List.of(), plan);
  }
}
