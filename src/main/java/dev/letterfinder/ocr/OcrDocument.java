package dev.letterfinder.ocr;

import java.util.List;
import java.util.stream.Collectors;

import dev.letterfinder.download.DownloadedDocument;

/** A downloaded document with the OCR text of each of its pages, in page order. */
public record OcrDocument(DownloadedDocument document, List<PageText> pages) {

    private static final String PAGE_SEPARATOR = "\n\n";

    public OcrDocument {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    /** All page texts joined by a blank line. */
    public String fullText() {
        return pages.stream().map(PageText::text).collect(Collectors.joining(PAGE_SEPARATOR));
    }
}
