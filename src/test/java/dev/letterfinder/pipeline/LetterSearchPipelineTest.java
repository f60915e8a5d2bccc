package dev.letterfinder.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.letterfinder.analysis.ExtractedLetter;
import dev.letterfinder.analysis.LetterExtractor;
import dev.letterfinder.analysis.RelevanceScorer;
import dev.letterfinder.download.DownloadManager;
import dev.letterfinder.download.DownloadedDocument;
import dev.letterfinder.fixture.SearchRecordBuilder;
import dev.letterfinder.fixture.TestProperties;
import dev.letterfinder.ocr.OcrDocument;
import dev.letterfinder.ocr.OcrProcessor;
import dev.letterfinder.ocr.PageText;
import dev.letterfinder.search.AggregatedSearch;
import dev.letterfinder.search.SearchAggregator;
import dev.letterfinder.search.SearchRecord;
import dev.letterfinder.search.SearchWindow;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LetterSearchPipelineTest {

  private static final SearchWindow WINDOW =
      new SearchWindow(LocalDate.of(1946, 10, 1), LocalDate.of(1946, 12, 5));

  private static final String LETTER =
      "12 November 1946\nDear Winston,\nIt was good to see you.\nYours sincerely,\nBryan Fairfax";

  @Mock private SearchAggregator searchAggregator;
  @Mock private DownloadManager downloadManager;
  @Mock private OcrProcessor ocrProcessor;

  private LetterSearchPipeline pipeline;

  @BeforeEach
  void setUp() {
    pipeline =
        new LetterSearchPipeline(
            searchAggregator,
            downloadManager,
            ocrProcessor,
            new RelevanceScorer(),
            new LetterExtractor(),
            TestProperties.with());
  }

  private static AggregatedSearch found(SearchRecord... records) {
    List<String> locations = new ArrayList<>();
    for (SearchRecord record : records) {
      locations.add(record.summaryLine(null));
    }
    return new AggregatedSearch(List.of(records), locations, 0);
  }

  private static DownloadedDocument downloaded(String reference) {
    return new DownloadedDocument(
        "LAC", reference, "Papers", "Nov 1946", List.of(Path.of(reference, "page_1.jpg")));
  }

  private static OcrDocument ocr(DownloadedDocument document, String text) {
    return new OcrDocument(document, List.of(new PageText(document.images().get(0), text)));
  }

  @Test
  void defaultWindowComesFromConfiguration() {
    assertThat(pipeline.defaultWindow()).isEqualTo(WINDOW);
  }

  @Test
  void fullSearchWithoutRecordsFails() {
    when(searchAggregator.aggregate(null, WINDOW)).thenReturn(found());

    PipelineResult result = pipeline.executeFullSearch(null, WINDOW, 5);

    assertThat(result.status()).isEqualTo(PipelineStatus.FAILURE);
    assertThat(result.reason()).isEqualTo("No search results found");
    verifyNoInteractions(downloadManager, ocrProcessor);
  }

  @Test
  void fullSearchWithoutDownloadsIsPartial() {
    SearchRecord record = new SearchRecordBuilder().date("Nov 1946").build();
    when(searchAggregator.aggregate(null, WINDOW)).thenReturn(found(record));
    when(downloadManager.download(List.of(record), 5)).thenReturn(List.of());

    PipelineResult result = pipeline.executeFullSearch(null, WINDOW, 5);

    assertThat(result.status()).isEqualTo(PipelineStatus.PARTIAL);
    assertThat(result.reason()).isEqualTo("No documents could be downloaded");
    assertThat(result.searchResultCount()).isEqualTo(1);
    assertThat(result.locations()).hasSize(1);
    verify(ocrProcessor, never()).processDocuments(anyList());
  }

  @Test
  void fullSearchWithLetterSucceeds() {
    SearchRecord record = new SearchRecordBuilder().reference("MG30").build();
    DownloadedDocument document = downloaded("MG30");
    when(searchAggregator.aggregate("Gooderham", WINDOW)).thenReturn(found(record));
    when(downloadManager.download(List.of(record), 3)).thenReturn(List.of(document));
    when(ocrProcessor.isOcrAvailable()).thenReturn(true);
    when(ocrProcessor.processDocuments(List.of(document)))
        .thenReturn(List.of(ocr(document, LETTER)));

    PipelineResult result = pipeline.executeFullSearch("Gooderham", WINDOW, 3);

    assertThat(result.status()).isEqualTo(PipelineStatus.SUCCESS);
    assertThat(result.reason()).isNull();
    assertThat(result.documentsProcessed()).isEqualTo(1);
    assertThat(result.lettersFound()).isEqualTo(1);
    assertThat(result.topMatches()).singleElement()
        .satisfies(letter -> assertThat(letter.relevanceScore()).isEqualTo(50));
    assertThat(result.plan()).isEqualTo(ResearchPlan.standard());
  }

  @Test
  void fullSearchWithoutLettersIsPartial() {
    SearchRecord record = new SearchRecordBuilder().build();
    DownloadedDocument document = downloaded("R1");
    when(searchAggregator.aggregate(null, WINDOW)).thenReturn(found(record));
    when(downloadManager.download(anyList(), anyInt())).thenReturn(List.of(document));
    when(ocrProcessor.isOcrAvailable()).thenReturn(false);
    when(ocrProcessor.processDocuments(anyList()))
        .thenReturn(List.of(ocr(document, "[OCR UNAVAILABLE - INSTALL REQUIRED DEPENDENCIES]")));

    PipelineResult result = pipeline.executeFullSearch(null, WINDOW, 5);

    assertThat(result.status()).isEqualTo(PipelineStatus.PARTIAL);
    assertThat(result.lettersFound()).isZero();
    assertThat(result.documentsProcessed()).isEqualTo(1);
  }

  @Test
  void topMatchesAreCappedAtThree() {
    List<DownloadedDocument> documents = new ArrayList<>();
    List<OcrDocument> ocrDocuments = new ArrayList<>();
    for (int i = 1; i <= 5; i++) {
      DownloadedDocument document = downloaded("R" + i);
      documents.add(document);
      ocrDocuments.add(ocr(document, LETTER));
    }
    when(searchAggregator.aggregate(null, WINDOW))
        .thenReturn(found(new SearchRecordBuilder().build()));
    when(downloadManager.download(anyList(), eq(5))).thenReturn(documents);
    when(ocrProcessor.isOcrAvailable()).thenReturn(true);
    when(ocrProcessor.processDocuments(documents)).thenReturn(ocrDocuments);

    PipelineResult result = pipeline.executeFullSearch(null, WINDOW, 5);

    assertThat(result.lettersFound()).isEqualTo(5);
    assertThat(result.topMatches())
        .hasSize(PipelineResult.TOP_MATCHES)
        .extracting(ExtractedLetter::reference)
        .containsExactly("R1", "R2", "R3");
  }

  @Test
  void fullSearchRejectsNonPositiveMaxDocs() {
    assertThatThrownBy(() -> pipeline.executeFullSearch(null, WINDOW, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void searchOnlyReportsLocationsWithoutDownloading() {
    SearchRecord record = new SearchRecordBuilder().reference("CHAR 20/1").date("Nov 1946").build();
    when(searchAggregator.aggregate(null, WINDOW)).thenReturn(found(record));

    PipelineResult result = pipeline.searchOnly(null, WINDOW);

    assertThat(result.status()).isEqualTo(PipelineStatus.PARTIAL);
    assertThat(result.locations()).containsExactly("CHAR 20/1 - Correspondence, Nov 1946");
    verifyNoInteractions(downloadManager, ocrProcessor);
  }

  @Test
  void searchOnlyWithoutRecordsFails() {
    when(searchAggregator.aggregate(any(), any())).thenReturn(found());

    assertThat(pipeline.searchOnly(null, WINDOW).status()).isEqualTo(PipelineStatus.FAILURE);
  }

  @Test
  void processDirectoryRunsOcrOnScannedDocuments(@TempDir Path root) throws Exception {
    Path page = Files.createDirectories(root.resolve("LAC_MG30")).resolve("page_1.png");
    Files.writeString(page, "x");
    when(ocrProcessor.isOcrAvailable()).thenReturn(true);
    when(ocrProcessor.processDocuments(anyList()))
        .thenAnswer(
            invocation -> {
              List<DownloadedDocument> docs = invocation.getArgument(0);
              return List.of(ocr(docs.get(0), LETTER));
            });

    PipelineResult result = pipeline.processDirectory(root);

    assertThat(result.status()).isEqualTo(PipelineStatus.SUCCESS);
    assertThat(result.topMatches()).singleElement()
        .satisfies(letter -> {
          assertThat(letter.archive()).isEqualTo("unknown");
          assertThat(letter.reference()).isEqualTo("LAC_MG30");
        });
    verifyNoInteractions(searchAggregator, downloadManager);
  }

  @Test
  void processDirectoryWithoutImagesFails(@TempDir Path root) {
    PipelineResult result = pipeline.processDirectory(root);

    assertThat(result.status()).isEqualTo(PipelineStatus.FAILURE);
    assertThat(result.reason()).startsWith("No image files found");
    verifyNoInteractions(ocrProcessor);
  }

  @Test
  void processDirectoryOnMissingPathFails(@TempDir Path root) {
    PipelineResult result = pipeline.processDirectory(root.resolve("absent"));

    assertThat(result.status()).isEqualTo(PipelineStatus.FAILURE);
    assertThat(result.reason()).startsWith("Directory not found");
  }
}
