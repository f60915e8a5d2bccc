package dev.letterfinder.pipeline;

import dev.letterfinder.analysis.AnalyzedDocument;
import dev.letterfinder.analysis.ExtractedLetter;
import dev.letterfinder.analysis.LetterExtractor;
import dev.letterfinder.analysis.RelevanceScorer;
import dev.letterfinder.config.LetterFinderProperties;
import dev.letterfinder.download.DownloadManager;
import dev.letterfinder.download.DownloadedDocument;
import dev.letterfinder.ocr.DocumentDirectoryScanner;
import dev.letterfinder.ocr.OcrDocument;
import dev.letterfinder.ocr.OcrProcessor;
import dev.letterfinder.search.AggregatedSearch;
import dev.letterfinder.search.SearchAggregator;
import dev.letterfinder.search.SearchWindow;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrates search, download, OCR and letter extraction. Every entry point returns a {@link
 * PipelineResult}; stage failures end the run early with a status, never with an exception.
 */
@Service
public class LetterSearchPipeline {

  private static final Logger log = LoggerFactory.getLogger(LetterSearchPipeline.class);

  private final SearchAggregator searchAggregator;
  private final DownloadManager downloadManager;
  private final OcrProcessor ocrProcessor;
  private final RelevanceScorer relevanceScorer;
  private final LetterExtractor letterExtractor;
  private final LetterFinderProperties properties;

  public LetterSearchPipeline(
      SearchAggregator searchAggregator,
      DownloadManager downloadManager,
      OcrProcessor ocrProcessor,
      RelevanceScorer relevanceScorer,
      LetterExtractor letterExtractor,
      LetterFinderProperties properties) {
    this.searchAggregator = searchAggregator;
    this.downloadManager = downloadManager;
    this.ocrProcessor = ocrProcessor;
    this.relevanceScorer = relevanceScorer;
    this.letterExtractor = letterExtractor;
    this.properties = properties;
  }

  /** The configured search window. */
  public SearchWindow defaultWindow() {
    return new SearchWindow(properties.searchWindow().start(), properties.searchWindow().end());
  }

  /**
   * Query all archives without downloading anything.
   *
   * @param customQuery optional extra query tried first against every archive
   * @param window date window for archives that accept one
   * @return FAILURE when nothing was found, PARTIAL otherwise
   */
  public PipelineResult searchOnly(@Nullable String customQuery, SearchWindow window) {
    log.info("Running basic search without OCR processing");
    AggregatedSearch search = searchAggregator.aggregate(customQuery, window);
    return PipelineResult.searchCompleted(search, ResearchPlan.standard());
  }

  /**
   * Search, download up to {@code maxDocs} documents, OCR them and extract letter candidates.
   *
   * @param customQuery optional extra query tried first against every archive
   * @param window date window for archives that accept one
   * @param maxDocs maximum number of documents to download
   * @return the run summary
   */
  public PipelineResult executeFullSearch(
      @Nullable String customQuery, SearchWindow window, int maxDocs) {
    if (maxDocs < 1) {
      throw new IllegalArgumentException("maxDocs must be at least 1, got " + maxDocs);
    }
    ResearchPlan plan = ResearchPlan.standard();
    log.info("===== BEGINNING COMPREHENSIVE SEARCH FOR FAIRFAX LETTER =====");

    log.info("Step 1: Searching archives for potential documents");
    AggregatedSearch search = searchAggregator.aggregate(customQuery, window);
    if (search.isEmpty()) {
      log.error("No results found in any archives");
      return PipelineResult.noSearchResults(plan);
    }

    log.info("Step 2: Downloading documents for OCR processing");
    List<DownloadedDocument> downloaded = downloadManager.download(search.records(), maxDocs);
    if (downloaded.isEmpty()) {
      log.error("Failed to download any documents");
      return PipelineResult.noDownloads(search, plan);
    }

    log.info("Step 3: Processing documents with OCR");
    warnIfOcrUnavailable();
    List<AnalyzedDocument> analyzed = analyze(downloaded);

    log.info("Step 4: Extracting potential letter content");
    List<ExtractedLetter> letters = letterExtractor.extractLetters(analyzed);

    PipelineResult result =
        PipelineResult.processed(
            search.records().size(), analyzed.size(), letters, search.locations(), plan);
    log.info("===== SEARCH COMPLETE: {} =====", result.status());
    return result;
  }

  /**
   * OCR every image directory below {@code directory} and extract letter candidates, skipping
   * search and download.
   *
   * @param directory root of previously downloaded documents
   * @return FAILURE when the directory is missing or holds no images, otherwise the run summary
   */
  public PipelineResult processDirectory(Path directory) {
    ResearchPlan plan = ResearchPlan.standard();
    if (!Files.isDirectory(directory)) {
      log.error("Directory not found: {}", directory);
      return PipelineResult.nothingToProcess("Directory not found: " + directory, plan);
    }

    List<DownloadedDocument> documents;
    try {
      documents = DocumentDirectoryScanner.scan(directory);
    } catch (IOException e) {
      log.error("Could not scan {}: {}", directory, e.getMessage());
      return PipelineResult.nothingToProcess("Could not scan " + directory, plan);
    }
    if (documents.isEmpty()) {
      log.error("No image files found in {}", directory);
      return PipelineResult.nothingToProcess("No image files found in " + directory, plan);
    }

    log.info("Running OCR on documents in {}", directory);
    warnIfOcrUnavailable();
    List<AnalyzedDocument> analyzed = analyze(documents);
    List<ExtractedLetter> letters = letterExtractor.extractLetters(analyzed);
    return PipelineResult.processed(0, analyzed.size(), letters, List.of(), plan);
  }

  private List<AnalyzedDocument> analyze(List<DownloadedDocument> documents) {
    List<OcrDocument> ocrDocuments = ocrProcessor.processDocuments(documents);
    List<AnalyzedDocument> analyzed = new ArrayList<>(ocrDocuments.size());
    for (OcrDocument document : ocrDocuments) {
      analyzed.add(relevanceScorer.analyze(document));
    }
    return analyzed;
  }

  private void warnIfOcrUnavailable() {
    if (!ocrProcessor.isOcrAvailable()) {
      log.warn(
          "OCR is not available; pages get placeholder text. Enable letterfinder.ocr and install"
              + " Tesseract language data to read document images");
    }
  }
}
