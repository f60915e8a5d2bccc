package dev.letterfinder.ocr;

import java.nio.file.Path;

/** Raw OCR text of one page image; empty when extraction failed. */
public record PageText(Path image, String text) {

    public PageText {
        text = text == null ? "" : text;
    }
}
