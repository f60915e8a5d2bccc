package dev.letterfinder.ocr;

/** Raised when a page image cannot be turned into text. */
public class TextExtractionException extends Exception {

    public TextExtractionException(String message) {
        super(message);
    }

    public TextExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
