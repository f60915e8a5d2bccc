package dev.letterfinder.ocr;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import dev.letterfinder.config.LetterFinderProperties;
import dev.letterfinder.download.DownloadedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs the configured {@link TextExtractor} over downloaded page images.
 *
 * <p>A failing page yields empty text and processing continues with the next page. Text from a
 * real OCR engine is also written to {@code {output}/{document folder}/{image name}.txt}, so
 * pages of different documents never overwrite each other.
 */
@Service
public class OcrProcessor {

    private static final Logger log = LoggerFactory.getLogger(OcrProcessor.class);

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of("png", "jpg", "jpeg", "tif", "tiff", "bmp");

    private final TextExtractor textExtractor;
    private final Path outputDirectory;

    @Autowired
    public OcrProcessor(TextExtractor textExtractor, LetterFinderProperties properties) {
        this(textExtractor, Path.of(properties.ocr().outputDirectory()));
    }

    public OcrProcessor(TextExtractor textExtractor, Path outputDirectory) {
        this.textExtractor = textExtractor;
        this.outputDirectory = outputDirectory;
    }

    public boolean isOcrAvailable() {
        return textExtractor.isAvailable();
    }

    /**
     * OCR every page of every document, in order.
     *
     * @param documents downloaded documents
     * @return one OCR document per input document
     */
    public List<OcrDocument> processDocuments(List<DownloadedDocument> documents) {
        log.info("Starting OCR processing of {} downloaded documents", documents.size());
        List<OcrDocument> processed = new ArrayList<>();
        for (DownloadedDocument document : documents) {
            processed.add(processDocument(document));
        }
        log.info("OCR processing complete for {} documents", processed.size());
        return processed;
    }

    public OcrDocument processDocument(DownloadedDocument document) {
        List<PageText> pages = new ArrayList<>();
        for (Path image : document.images()) {
            processImage(image).ifPresent(pages::add);
        }
        return new OcrDocument(document, pages);
    }

    /**
     * OCR one image.
     *
     * @param image page image
     * @return the page text (empty text on failure), or empty if the file type is not an image
     */
    public Optional<PageText> processImage(Path image) {
        if (!isSupportedImage(image)) {
            log.warn("Unsupported document format: {}", image);
            return Optional.empty();
        }
        if (!textExtractor.isAvailable()) {
            log.warn("Cannot process {}: OCR functionality is disabled", image);
            return Optional.of(new PageText(image, extractQuietly(image)));
        }

        log.info("Processing image with OCR: {}", image);
        String text = extractQuietly(image);
        if (!text.isEmpty()) {
            saveText(image, text);
        }
        return Optional.of(new PageText(image, text));
    }

    static boolean isSupportedImage(Path image) {
        String name = image.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && SUPPORTED_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private String extractQuietly(Path image) {
        try {
            return textExtractor.extractText(image);
        } catch (TextExtractionException e) {
            log.error("OCR processing error for {}: {}", image, e.getMessage());
            return "";
        } catch (RuntimeException e) {
            log.error("Unexpected OCR failure for {}: {}", image, e.getMessage());
            return "";
        }
    }

    private void saveText(Path image, String text) {
        Path target = textFileFor(image);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, text, StandardCharsets.UTF_8);
            log.info("OCR completed. Text saved to {}", target);
        } catch (IOException e) {
            log.warn("Could not save OCR text for {} to {}: {}", image, target, e.getMessage());
        }
    }

    Path textFileFor(Path image) {
        String fileName = image.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        Path parent = image.toAbsolutePath().getParent();
        Path folder = parent == null || parent.getFileName() == null
                ? outputDirectory
                : outputDirectory.resolve(parent.getFileName().toString());
        return folder.resolve(baseName + ".txt");
    }
}
