package dev.letterfinder.archive;

import java.time.Clock;

import dev.letterfinder.config.ArchiveDescriptor;
import dev.letterfinder.config.LetterFinderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Builds one {@link ArchiveClient} per {@link ArchiveDescriptor}, each with its own
 * {@link RestClient}, its own {@link RequestPacer} and its own download retry template.
 *
 * <p>The archive credential is looked up in the Spring {@link Environment} under the descriptor's
 * {@code api-key-env} name; when present it is sent as a bearer token, otherwise requests go out
 * unauthenticated.
 */
public class ArchiveClientFactory {

    private static final Logger log = LoggerFactory.getLogger(ArchiveClientFactory.class);

    private final RestClient.Builder restClientBuilder;
    private final LetterFinderProperties properties;
    private final Environment environment;
    private final Clock clock;
    private final Sleeper sleeper;

    public ArchiveClientFactory(RestClient.Builder restClientBuilder, LetterFinderProperties properties,
                                Environment environment, Clock clock, Sleeper sleeper) {
        this.restClientBuilder = restClientBuilder;
        this.properties = properties;
        this.environment = environment;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public ArchiveClient create(ArchiveDescriptor descriptor) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.http().connectTimeout());
        requestFactory.setReadTimeout(properties.http().readTimeout());

        RestClient.Builder builder = restClientBuilder.clone()
                .baseUrl(descriptor.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE, MediaType.ALL_VALUE);

        String apiKey = environment.getProperty(descriptor.apiKeyEnv());
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
            log.info("Using credential from {} for {}", descriptor.apiKeyEnv(), descriptor.name());
        } else {
            log.info("No credential in {}; {} will be queried unauthenticated",
                    descriptor.apiKeyEnv(), descriptor.name());
        }

        return new ArchiveClient(
                descriptor,
                builder.build(),
                new RequestPacer(properties.rateLimitInterval(), clock, sleeper),
                downloadRetryTemplate());
    }

    RetryTemplate downloadRetryTemplate() {
        return RetryTemplate.builder()
                .maxAttempts(properties.download().maxAttempts())
                .retryOn(RestClientException.class)
                .customBackoff(new LinearBackOffPolicy(properties.download().backoffBase(), sleeper))
                .build();
    }
}
