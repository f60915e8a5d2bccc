package dev.letterfinder.download;

import java.nio.file.Path;
import java.util.List;

/**
 * A search record whose images were (at least partly) fetched to local disk.
 *
 * @param archive archive name of the originating record
 * @param reference catalog reference of the originating record
 * @param title item title
 * @param date free-text catalogue date
 * @param images local page images in page order, never empty
 */
public record DownloadedDocument(
    String archive, String reference, String title, String date, List<Path> images) {

  public DownloadedDocument {
    images = images == null ? List.of() : List.copyOf(images);
    if (images.isEmpty()) {
      throw new IllegalArgumentException("A downloaded document needs at least one image");
    }
  }
}
