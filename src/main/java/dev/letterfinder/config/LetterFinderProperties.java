package dev.letterfinder.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;

/**
 * Externalised configuration for the letter search, bound from {@code letterfinder.*}.
 *
 * <ul>
 *   <li>{@code archives} - the catalogs to query, see {@link ArchiveDescriptor}
 *   <li>{@code rate-limit-interval} - minimum gap between two requests of the same archive client
 *       (default 1s). Every archive gets its own pacing budget.
 *   <li>{@code download.*} - image download directory, retry attempts and linear backoff base
 *   <li>{@code ocr.*} - Tesseract switch, tessdata location and OCR text output directory
 *   <li>{@code http.*} - per-request connect and read timeouts
 *   <li>{@code search-window.*} - the date window sent to archives that accept a date range
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "letterfinder")
public record LetterFinderProperties(
    @NotEmpty List<@Valid ArchiveDescriptor> archives,
    @DefaultValue("1s") @NotNull Duration rateLimitInterval,
    @Valid @DefaultValue Download download,
    @Valid @DefaultValue Ocr ocr,
    @Valid @DefaultValue Http http,
    @Valid @DefaultValue Window searchWindow) {

  public LetterFinderProperties {
    archives = archives == null ? List.of() : List.copyOf(archives);
  }

  public record Download(
      @DefaultValue("downloaded_documents") @NotBlank String directory,
      @DefaultValue("3") @Positive int maxAttempts,
      @DefaultValue("2s") @NotNull Duration backoffBase,
      @DefaultValue("5") @Positive int defaultMaxDocs) {}

  public record Ocr(
      @DefaultValue("false") boolean enabled,
      @Nullable String dataPath,
      @DefaultValue("eng") @NotBlank String language,
      @DefaultValue("ocr_results") @NotBlank String outputDirectory) {}

  public record Http(
      @DefaultValue("10s") @NotNull Duration connectTimeout,
      @DefaultValue("30s") @NotNull Duration readTimeout) {}

  public record Window(
      @DefaultValue("1946-10-01") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
      @DefaultValue("1946-12-05") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {}
}
