package dev.letterfinder.analysis;

import dev.letterfinder.ocr.OcrDocument;

/** An OCR'd document together with its relevance analysis. */
public record AnalyzedDocument(OcrDocument ocr, Analysis analysis) {}
