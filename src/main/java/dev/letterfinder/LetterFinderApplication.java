package dev.letterfinder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Fairfax letter finder.
 *
 * <p>Runs as a command-line application (no web server): searches the configured archives and,
 * with {@code --full} or {@code --ocr-only}, downloads and reads document images looking for
 * Fairfax's 1946 letter to Churchill.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class LetterFinderApplication {
    public static void main(String[] args) {
        SpringApplication.run(LetterFinderApplication.class, args);
    }
}
