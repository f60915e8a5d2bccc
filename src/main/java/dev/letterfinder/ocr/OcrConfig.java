package dev.letterfinder.ocr;

import java.nio.file.Files;
import java.nio.file.Path;

import dev.letterfinder.config.LetterFinderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the {@link TextExtractor} once at startup: Tesseract when {@code letterfinder.ocr.enabled}
 * is set and the tessdata directory exists, the placeholder extractor otherwise.
 */
@Configuration
public class OcrConfig {

    private static final Logger log = LoggerFactory.getLogger(OcrConfig.class);

    @Bean
    public TextExtractor textExtractor(LetterFinderProperties properties) {
        LetterFinderProperties.Ocr ocr = properties.ocr();
        if (!ocr.enabled()) {
            log.warn("OCR functionality is disabled (letterfinder.ocr.enabled=false)");
            return new UnavailableTextExtractor();
        }
        if (ocr.dataPath() == null || !Files.isDirectory(Path.of(ocr.dataPath()))) {
            log.warn("OCR functionality is disabled: tessdata directory not found at {}", ocr.dataPath());
            log.warn("Install Tesseract OCR and point letterfinder.ocr.data-path at its tessdata directory");
            return new UnavailableTextExtractor();
        }
        log.info("Using Tesseract OCR with tessdata at {} (language {})", ocr.dataPath(), ocr.language());
        return new TesseractTextExtractor(Path.of(ocr.dataPath()), ocr.language());
    }
}
