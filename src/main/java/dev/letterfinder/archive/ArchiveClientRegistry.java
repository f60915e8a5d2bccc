package dev.letterfinder.archive;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of archive clients by archive name, in configuration order. Records refer to their
 * archive by name; a name with no client is a soft miss for the caller to log.
 */
public class ArchiveClientRegistry {

    private final Map<String, ArchiveClient> clients;

    public ArchiveClientRegistry(List<ArchiveClient> clients) {
        Map<String, ArchiveClient> byName = new LinkedHashMap<>();
        for (ArchiveClient client : clients) {
            if (byName.putIfAbsent(client.name(), client) != null) {
                throw new IllegalStateException("Duplicate archive name: " + client.name());
            }
        }
        this.clients = Collections.unmodifiableMap(byName);
    }

    public Optional<ArchiveClient> find(String archiveName) {
        return Optional.ofNullable(clients.get(archiveName));
    }

    public Collection<ArchiveClient> all() {
        return clients.values();
    }
}
