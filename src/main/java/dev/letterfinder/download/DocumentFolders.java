package dev.letterfinder.download;

import java.nio.file.Path;
import java.util.regex.Pattern;

/** Naming scheme for per-document download directories and page files. */
public final class DocumentFolders {

  /** Control characters and characters that some file systems refuse in a name. */
  private static final Pattern UNSAFE = Pattern.compile("[\\p{Cntrl}/\\\\:*?\"<>|]");

  private DocumentFolders() {
    // utility class
  }

  /**
   * Directory name for one document: {@code {archive}_{reference}} with path separators, control
   * characters and other characters unsafe in file names replaced by underscores.
   */
  public static String folderName(String archive, String reference) {
    return archive + "_" + sanitize(reference);
  }

  /** Page file for the 1-based page number, e.g. {@code page_1.jpg}. */
  public static Path pageFile(Path documentFolder, int pageNumber) {
    return documentFolder.resolve("page_" + pageNumber + ".jpg");
  }

  static String sanitize(String reference) {
    return UNSAFE.matcher(reference).replaceAll("_");
  }
}
