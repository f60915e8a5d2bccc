package dev.letterfinder.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Static description of one archive catalog: where it lives, which endpoints it exposes, which
 * collections are known to hold relevant papers, and which environment variable carries its
 * credential.
 *
 * <p>Bound once at startup from {@code letterfinder.archives[*]}.
 *
 * @param name display name, also the key records use to find their client
 * @param baseUrl catalog base URL
 * @param searchEndpoint path of the search endpoint, relative to {@code baseUrl}
 * @param itemEndpoint path of the item endpoint, or null when the catalog has none
 * @param collections known collection identifiers
 * @param apiKeyEnv name of the environment variable holding the bearer token
 * @param summaryPrefix short label used in location summaries (null for none)
 * @param plan queries issued against this archive, or null to skip it during aggregation
 */
public record ArchiveDescriptor(
    @NotBlank String name,
    @NotBlank String baseUrl,
    @NotBlank String searchEndpoint,
    @Nullable String itemEndpoint,
    List<String> collections,
    @NotBlank String apiKeyEnv,
    @Nullable String summaryPrefix,
    @Valid @Nullable QueryPlan plan) {

  public ArchiveDescriptor {
    collections = collections == null ? List.of() : List.copyOf(collections);
  }

  public boolean hasItemEndpoint() {
    return itemEndpoint != null && !itemEndpoint.isBlank();
  }

  /**
   * Hand-curated query variants for one archive.
   *
   * @param queries phrasings issued in order
   * @param limit result limit per query
   * @param collection collection constraint passed to the archive, or null
   * @param useSearchWindow whether the run's date window is sent as a date range
   */
  public record QueryPlan(
      @NotEmpty List<String> queries,
      @DefaultValue("20") @Positive int limit,
      @Nullable String collection,
      @DefaultValue("false") boolean useSearchWindow) {

    public QueryPlan {
      queries = queries == null ? List.of() : List.copyOf(queries);
    }
  }
}
