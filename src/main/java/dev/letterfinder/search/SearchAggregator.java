package dev.letterfinder.search;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import dev.letterfinder.archive.ArchiveClient;
import dev.letterfinder.archive.ArchiveClientRegistry;
import dev.letterfinder.archive.ArchiveItem;
import dev.letterfinder.archive.ArchiveSearchResult;
import dev.letterfinder.archive.SearchOptions;
import dev.letterfinder.config.ArchiveDescriptor;
import dev.letterfinder.config.LetterFinderProperties;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs every configured archive's query plan and merges the normalized hits.
 *
 * <p>Archives are queried in configuration order and each query variant in plan order. One
 * archive or query failing never stops the others: errors are logged and the run moves on.
 */
@Service
public class SearchAggregator {

    private static final Logger log = LoggerFactory.getLogger(SearchAggregator.class);

    private final ArchiveClientRegistry clients;
    private final LetterFinderProperties properties;

    public SearchAggregator(ArchiveClientRegistry clients, LetterFinderProperties properties) {
        this.clients = clients;
        this.properties = properties;
    }

    /**
     * Query all archives that carry a plan.
     *
     * @param customQuery optional extra phrasing, issued first against every archive
     * @param window      date window for archives whose plan uses one
     * @return accumulated records and their location summaries
     */
    public AggregatedSearch aggregate(@Nullable String customQuery, SearchWindow window) {
        List<SearchRecord> records = new ArrayList<>();
        List<String> locations = new ArrayList<>();
        int failedQueries = 0;

        for (ArchiveDescriptor archive : properties.archives()) {
            ArchiveDescriptor.QueryPlan plan = archive.plan();
            if (plan == null) {
                log.debug("No query plan for {}, skipping", archive.name());
                continue;
            }
            Optional<ArchiveClient> client = clients.find(archive.name());
            if (client.isEmpty()) {
                log.warn("No API client found for {}", archive.name());
                continue;
            }

            int before = records.size();
            for (String query : queryVariants(customQuery, plan)) {
                if (!searchOnce(client.get(), archive, plan, query, window, records, locations)) {
                    failedQueries++;
                }
            }

            int found = records.size() - before;
            if (found == 0) {
                log.warn("No results found in {}", archive.name());
            } else {
                log.info("Found {} potential documents in {}", found, archive.name());
            }
        }

        log.info("Search complete: {} records across {} archives ({} failed queries)",
                records.size(), properties.archives().size(), failedQueries);
        return new AggregatedSearch(records, locations, failedQueries);
    }

    private boolean searchOnce(
            ArchiveClient client,
            ArchiveDescriptor archive,
            ArchiveDescriptor.QueryPlan plan,
            String query,
            SearchWindow window,
            List<SearchRecord> records,
            List<String> locations) {
        try {
            ArchiveSearchResult result = client.search(query, optionsFor(plan, window));
            if (!result.success()) {
                log.error("Search error for {} with query '{}': {}", archive.name(), query, result.error());
                return false;
            }
            for (ArchiveItem item : result.results()) {
                SearchRecord record = SearchRecord.fromItem(archive.name(), item);
                records.add(record);
                locations.add(record.summaryLine(archive.summaryPrefix()));
            }
            return true;
        } catch (RuntimeException e) {
            log.error("Error searching {} with query '{}': {}", archive.name(), query, e.getMessage());
            return false;
        }
    }

    static SearchOptions optionsFor(ArchiveDescriptor.QueryPlan plan, SearchWindow window) {
        SearchOptions options = SearchOptions.defaults()
                .withLimit(plan.limit())
                .withCollection(plan.collection());
        return plan.useSearchWindow() ? options.withDateRange(window.start(), window.end()) : options;
    }

    static List<String> queryVariants(@Nullable String customQuery, ArchiveDescriptor.QueryPlan plan) {
        Set<String> variants = new LinkedHashSet<>();
        if (customQuery != null && !customQuery.isBlank()) {
            variants.add(customQuery.trim());
        }
        variants.addAll(plan.queries());
        return List.copyOf(variants);
    }
}
