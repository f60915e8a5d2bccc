package dev.letterfinder.download;

import dev.letterfinder.archive.ArchiveClient;
import dev.letterfinder.archive.ArchiveClientRegistry;
import dev.letterfinder.config.LetterFinderProperties;
import dev.letterfinder.search.SearchRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Turns a bounded number of search records into downloaded documents.
 *
 * <p>Records are visited in {@link DocumentPrioritizer} order until {@code maxDocs} documents have
 * at least one page on disk. A record with no images, no matching archive client, or only failed
 * downloads is skipped and does not count towards the limit. Each document gets its own
 * directory under the download root; see {@link DocumentFolders}.
 */
@Service
public class DownloadManager {

  private static final Logger log = LoggerFactory.getLogger(DownloadManager.class);

  private final ArchiveClientRegistry clients;
  private final Path downloadRoot;

  @Autowired
  public DownloadManager(ArchiveClientRegistry clients, LetterFinderProperties properties) {
    this(clients, Path.of(properties.download().directory()));
  }

  public DownloadManager(ArchiveClientRegistry clients, Path downloadRoot) {
    this.clients = clients;
    this.downloadRoot = downloadRoot;
  }

  /**
   * Download page images for the highest-priority records.
   *
   * @param records all accumulated search records
   * @param maxDocs maximum number of documents to produce
   * @return documents with at least one downloaded page, in download order
   */
  public List<DownloadedDocument> download(List<SearchRecord> records, int maxDocs) {
    log.info("Starting document download process for up to {} documents", maxDocs);

    List<DownloadedDocument> downloaded = new ArrayList<>();
    for (SearchRecord record : DocumentPrioritizer.prioritize(records)) {
      if (downloaded.size() >= maxDocs) {
        break;
      }
      downloadRecord(record).ifPresent(downloaded::add);
    }

    int totalImages = downloaded.stream().mapToInt(doc -> doc.images().size()).sum();
    log.info(
        "Download complete: {} documents with {} total images", downloaded.size(), totalImages);
    return downloaded;
  }

  private Optional<DownloadedDocument> downloadRecord(SearchRecord record) {
    Optional<ArchiveClient> client = clients.find(record.archive());
    if (client.isEmpty()) {
      log.warn("No API client found for {}", record.archive());
      return Optional.empty();
    }
    if (record.imageUrls().isEmpty()) {
      log.info("No images available for {}", record.reference());
      return Optional.empty();
    }

    Path folder;
    try {
      folder = downloadRoot.resolve(DocumentFolders.folderName(record.archive(), record.reference()));
    } catch (InvalidPathException e) {
      log.error("Cannot use reference {} as a folder name: {}", record.reference(), e.getMessage());
      return Optional.empty();
    }
    try {
      Files.createDirectories(folder);
    } catch (IOException e) {
      log.error("Cannot create document folder {}: {}", folder, e.getMessage());
      return Optional.empty();
    }

    List<Path> pages = new ArrayList<>();
    List<String> urls = record.imageUrls();
    for (int i = 0; i < urls.size(); i++) {
      Path target = DocumentFolders.pageFile(folder, i + 1);
      if (client.get().downloadImage(urls.get(i), target)) {
        pages.add(target);
      }
    }

    if (pages.isEmpty()) {
      log.warn("No images could be downloaded for {}", record.reference());
      return Optional.empty();
    }
    log.info("Downloaded {} images for {}", pages.size(), record.reference());
    return Optional.of(
        new DownloadedDocument(
            record.archive(), record.reference(), record.title(), record.date(), pages));
  }
}
