package dev.letterfinder.ocr;

import java.nio.file.Path;

/** Stand-in used when no OCR engine is configured; every page yields the same placeholder. */
public class UnavailableTextExtractor implements TextExtractor {

    public static final String PLACEHOLDER = "[OCR UNAVAILABLE - INSTALL REQUIRED DEPENDENCIES]";

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String extractText(Path image) {
        return PLACEHOLDER;
    }
}
