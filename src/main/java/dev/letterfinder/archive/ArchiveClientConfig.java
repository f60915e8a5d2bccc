package dev.letterfinder.archive;

import java.time.Clock;

import dev.letterfinder.config.LetterFinderProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.web.client.RestClient;

/**
 * Wires one {@link ArchiveClient} per configured archive.
 *
 * <p>Timeouts, pacing interval and download retry settings come from {@code letterfinder.*}; the
 * Spring-provided {@link RestClient.Builder} supplies the shared message converters.
 */
@Configuration
public class ArchiveClientConfig {

    @Bean
    public ArchiveClientRegistry archiveClientRegistry(
            RestClient.Builder builder,
            LetterFinderProperties properties,
            Environment environment,
            Clock clock,
            Sleeper sleeper) {

        var factory = new ArchiveClientFactory(builder, properties, environment, clock, sleeper);
        return new ArchiveClientRegistry(
                properties.archives().stream().map(factory::create).toList());
    }
}
