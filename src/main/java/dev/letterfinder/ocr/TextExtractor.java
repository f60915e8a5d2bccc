package dev.letterfinder.ocr;

import java.nio.file.Path;

/**
 * Text-from-image capability. The implementation is chosen once at startup by {@link OcrConfig}.
 */
public interface TextExtractor {

    /** Whether this extractor runs a real OCR engine. */
    boolean isAvailable();

    /**
     * Extract the text of one scanned page.
     *
     * @param image path to an image file
     * @return the recognised text, possibly empty
     * @throws TextExtractionException if the image cannot be decoded or the engine fails
     */
    String extractText(Path image) throws TextExtractionException;
}
