package dev.letterfinder.archive;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

import dev.letterfinder.config.ArchiveDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriBuilder;

/**
 * Polite access to one archive's search, item and image endpoints.
 *
 * <p>Every request first waits on this client's {@link RequestPacer}. Search and item lookups
 * never throw: transport errors, error statuses, timeouts and {@code {"error": ...}} bodies all
 * come back as error-tagged results. Image downloads are retried through the supplied
 * {@link RetryTemplate} and report a boolean.
 */
public class ArchiveClient {

    private static final Logger log = LoggerFactory.getLogger(ArchiveClient.class);

    private final ArchiveDescriptor descriptor;
    private final RestClient restClient;
    private final RequestPacer pacer;
    private final RetryTemplate downloadRetryTemplate;

    public ArchiveClient(ArchiveDescriptor descriptor, RestClient restClient, RequestPacer pacer,
                         RetryTemplate downloadRetryTemplate) {
        this.descriptor = descriptor;
        this.restClient = restClient;
        this.pacer = pacer;
        this.downloadRetryTemplate = downloadRetryTemplate;
    }

    public String name() {
        return descriptor.name();
    }

    public ArchiveDescriptor descriptor() {
        return descriptor;
    }

    /**
     * Search the archive's catalogue.
     *
     * @param query   free-text query
     * @param options paging, date range and collection filter
     * @return the results, or an error-tagged empty result when the call failed
     */
    public ArchiveSearchResult search(String query, SearchOptions options) {
        pacer.awaitTurn();
        log.info("Searching {} with query: {}", name(), query);

        try {
            ArchiveSearchResponse response = restClient.get()
                    .uri(uriBuilder -> buildSearchUri(uriBuilder, query, options))
                    .retrieve()
                    .body(ArchiveSearchResponse.class);

            if (response == null) {
                return ArchiveSearchResult.failed(name(), query, "Empty response from " + name());
            }
            if (response.error() != null) {
                log.warn("{} reported a search error: {}", name(), response.error());
                return ArchiveSearchResult.failed(name(), query, response.error());
            }
            return ArchiveSearchResult.succeeded(name(), query, response.results());
        } catch (RestClientException e) {
            log.error("Error searching {}: {}", name(), e.getMessage());
            return ArchiveSearchResult.failed(name(), query, String.valueOf(e.getMessage()));
        } catch (IllegalArgumentException e) {
            log.error("Cannot build search request for {}: {}", name(), e.getMessage());
            return ArchiveSearchResult.failed(name(), query, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Retrieve item metadata by archive identifier.
     *
     * @param documentId the archive's item identifier
     * @return the item, or an error-tagged result
     */
    public DocumentLookupResult getDocument(String documentId) {
        if (!descriptor.hasItemEndpoint()) {
            return DocumentLookupResult.failed(name(), documentId, name() + " exposes no item endpoint");
        }
        pacer.awaitTurn();
        log.info("Retrieving document {} from {}", documentId, name());

        try {
            ArchiveItemResponse response = restClient.get()
                    .uri(uriBuilder -> uriBuilder.path(descriptor.itemEndpoint())
                            .pathSegment("{id}")
                            .build(documentId))
                    .retrieve()
                    .body(ArchiveItemResponse.class);

            if (response == null) {
                return DocumentLookupResult.failed(name(), documentId, "Empty response from " + name());
            }
            if (response.error() != null) {
                return DocumentLookupResult.failed(name(), documentId, response.error());
            }
            return DocumentLookupResult.found(name(), documentId, response.toItem());
        } catch (RestClientException e) {
            log.error("Error retrieving document {} from {}: {}", documentId, name(), e.getMessage());
            return DocumentLookupResult.failed(name(), documentId, String.valueOf(e.getMessage()));
        } catch (IllegalArgumentException e) {
            log.error("Cannot build item request for {} on {}: {}", documentId, name(), e.getMessage());
            return DocumentLookupResult.failed(name(), documentId, String.valueOf(e.getMessage()));
        }
    }

    /**
     * Stream an image to a local file, retrying transport failures with linear backoff.
     *
     * @param imageUrl    absolute URL, or a path relative to the archive base URL
     * @param destination target file; parent directories are created as needed
     * @return true when the file was written, false once every attempt has failed
     */
    public boolean downloadImage(String imageUrl, Path destination) {
        log.info("Downloading image from {}: {}", name(), imageUrl);

        URI uri;
        try {
            uri = resolveImageUri(imageUrl);
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IllegalArgumentException | IOException e) {
            log.error("Cannot download {} to {}: {}", imageUrl, destination, e.getMessage());
            return false;
        }

        try {
            return downloadRetryTemplate.execute(
                    context -> attemptDownload(context, uri, destination),
                    context -> {
                        log.error("Failed to download {} after {} attempts: {}", imageUrl,
                                context.getRetryCount(), describe(context.getLastThrowable()));
                        return false;
                    });
        } catch (BackOffInterruptedException e) {
            log.warn("Download of {} interrupted during backoff", imageUrl);
            return false;
        }
    }

    private boolean attemptDownload(RetryContext context, URI uri, Path destination) {
        pacer.awaitTurn();
        Path folder = destination.toAbsolutePath().getParent();
        try {
            restClient.get()
                    .uri(uri)
                    .exchange((request, response) -> {
                        if (response.getStatusCode().isError()) {
                            throw new RestClientException(
                                    "HTTP " + response.getStatusCode().value() + " for " + uri);
                        }
                        writeAtomically(response.getBody(), folder, destination);
                        return destination;
                    });
        } catch (RestClientException e) {
            log.warn("Download attempt {} failed: {}", context.getRetryCount() + 1, e.getMessage());
            throw e;
        }
        log.info("Successfully downloaded to {}", destination);
        return true;
    }

    /**
     * Stream into a sibling {@code .part} file and rename it over the destination once complete,
     * so an interrupted transfer never leaves a truncated page behind.
     */
    private static void writeAtomically(InputStream source, Path folder, Path destination)
            throws IOException {
        Path partial = Files.createTempFile(folder, destination.getFileName().toString() + ".", ".part");
        try (InputStream body = source) {
            Files.copy(body, partial, StandardCopyOption.REPLACE_EXISTING);
            Files.move(partial, destination, StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(partial);
        }
    }

    // Values go in as template variables so braces and '+' in a query are encoded, not expanded.
    private URI buildSearchUri(UriBuilder uriBuilder, String query, SearchOptions options) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("q", query);
        variables.put("page", options.page());
        variables.put("limit", options.limit());
        uriBuilder.path(descriptor.searchEndpoint())
                .queryParam("q", "{q}")
                .queryParam("page", "{page}")
                .queryParam("limit", "{limit}");
        if (options.hasDateRange()) {
            variables.put("date_from", DateTimeFormatter.ISO_LOCAL_DATE.format(options.startDate()));
            variables.put("date_to", DateTimeFormatter.ISO_LOCAL_DATE.format(options.endDate()));
            uriBuilder.queryParam("date_from", "{date_from}")
                    .queryParam("date_to", "{date_to}");
        }
        if (options.collection() != null) {
            variables.put("collection", options.collection());
            uriBuilder.queryParam("collection", "{collection}");
        }
        return uriBuilder.build(variables);
    }

    private URI resolveImageUri(String imageUrl) {
        URI uri = URI.create(imageUrl);
        return uri.isAbsolute() ? uri : URI.create(descriptor.baseUrl()).resolve(uri);
    }

    private static String describe(Throwable throwable) {
        return throwable == null ? "unknown error" : String.valueOf(throwable.getMessage());
    }
}
