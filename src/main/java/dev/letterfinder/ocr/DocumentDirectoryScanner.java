package dev.letterfinder.ocr;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

import dev.letterfinder.download.DownloadedDocument;

/**
 * Rebuilds documents from a directory tree of previously downloaded scans. Every directory that
 * directly contains image files becomes one document named after the directory; its images are
 * taken in file-name order.
 */
public final class DocumentDirectoryScanner {

    static final String UNKNOWN_ARCHIVE = "unknown";

    private DocumentDirectoryScanner() {
        // utility class
    }

    /**
     * Scan a directory tree.
     *
     * @param root directory to walk
     * @return one document per image-bearing directory, ordered by directory path
     * @throws IOException if the tree cannot be walked
     */
    public static List<DownloadedDocument> scan(Path root) throws IOException {
        Map<Path, List<Path>> imagesByFolder = new TreeMap<>();
        try (Stream<Path> paths = Files.walk(root)) {
            paths.filter(Files::isRegularFile)
                    .filter(OcrProcessor::isSupportedImage)
                    .sorted()
                    .forEach(image -> imagesByFolder
                            .computeIfAbsent(image.getParent(), folder -> new ArrayList<>())
                            .add(image));
        }

        List<DownloadedDocument> documents = new ArrayList<>();
        imagesByFolder.forEach((folder, images) -> {
            String name = folder.getFileName() == null ? folder.toString() : folder.getFileName().toString();
            documents.add(new DownloadedDocument(UNKNOWN_ARCHIVE, name, name, "", images));
        });
        return documents;
    }
}
