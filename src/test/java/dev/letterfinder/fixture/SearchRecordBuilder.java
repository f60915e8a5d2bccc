package dev.letterfinder.fixture;

import dev.letterfinder.search.SearchRecord;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Test builder for {@link SearchRecord} with sensible defaults, so tests only override what they
 * care about.
 *
 * <pre>{@code
 * SearchRecord record = new SearchRecordBuilder().date("12 Nov 1946").images("a.jpg").build();
 * }</pre>
 */
public final class SearchRecordBuilder {

  private String archive = "Test Archive";
  private String reference = "CHAR 20/123";
  private String title = "Correspondence";
  private String date = "";
  private @Nullable String itemId = "item-1";
  private List<String> imageUrls = new ArrayList<>();

  public SearchRecordBuilder archive(String archive) {
    this.archive = archive;
    return this;
  }

  public SearchRecordBuilder reference(String reference) {
    this.reference = reference;
    return this;
  }

  public SearchRecordBuilder title(String title) {
    this.title = title;
    return this;
  }

  public SearchRecordBuilder date(String date) {
    this.date = date;
    return this;
  }

  public SearchRecordBuilder itemId(@Nullable String itemId) {
    this.itemId = itemId;
    return this;
  }

  public SearchRecordBuilder images(String... imageUrls) {
    this.imageUrls = new ArrayList<>(List.of(imageUrls));
    return this;
  }

  public SearchRecord build() {
    return new SearchRecord(archive, reference, title, date, itemId, imageUrls);
  }
}
