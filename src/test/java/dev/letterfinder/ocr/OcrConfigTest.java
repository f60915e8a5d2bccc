package dev.letterfinder.ocr;

import static org.assertj.core.api.Assertions.assertThat;

import dev.letterfinder.config.LetterFinderProperties;
import dev.letterfinder.fixture.TestProperties;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OcrConfigTest {

  @TempDir Path tessdata;

  private static LetterFinderProperties withOcr(LetterFinderProperties.Ocr ocr) {
    LetterFinderProperties base = TestProperties.with();
    return new LetterFinderProperties(
        base.archives(), base.rateLimitInterval(), base.download(), ocr, base.http(), base.searchWindow());
  }

  @Test
  void disabledOcrUsesPlaceholderExtractor() {
    TextExtractor extractor =
        new OcrConfig()
            .textExtractor(
                withOcr(new LetterFinderProperties.Ocr(false, tessdata.toString(), "eng", "out")));

    assertThat(extractor).isInstanceOf(UnavailableTextExtractor.class);
    assertThat(extractor.isAvailable()).isFalse();
  }

  @Test
  void missingTessdataUsesPlaceholderExtractor() {
    TextExtractor extractor =
        new OcrConfig()
            .textExtractor(
                withOcr(
                    new LetterFinderProperties.Ocr(
                        true, tessdata.resolve("absent").toString(), "eng", "out")));

    assertThat(extractor).isInstanceOf(UnavailableTextExtractor.class);
  }

  @Test
  void enabledOcrWithTessdataUsesTesseract() {
    TextExtractor extractor =
        new OcrConfig()
            .textExtractor(
                withOcr(new LetterFinderProperties.Ocr(true, tessdata.toString(), "eng", "out")));

    assertThat(extractor).isInstanceOf(TesseractTextExtractor.class);
    assertThat(extractor.isAvailable()).isTrue();
  }
}
