package com.ledgerlens.backend.services.imports.dedup;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.ledgerlens.backend.config.ImportProperties;
import com.ledgerlens.backend.repositories.ImportedTransactionRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Per-user set of fingerprints already stored, kept for a short TTL so back-to-back imports
 * don't reload the whole history. Callers invalidate a user after writing.
 */
@Slf4j
@Component
public class KnownFingerprintCache {

    private record Entry(Set<String> fingerprints, Instant loadedAt) {
    }

    private final Function<UUID, Set<String>> loader;
    private final Duration ttl;
    private final Clock clock;
    private final Map<UUID, Entry> entries = new ConcurrentHashMap<>();

    @Autowired
    public KnownFingerprintCache(ImportedTransactionRepository repository, ImportProperties importProperties) {
        this(repository::findFingerprintsByUserId, importProperties.fingerprintCacheTtl(), Clock.systemUTC());
    }

    KnownFingerprintCache(Function<UUID, Set<String>> loader, Duration ttl, Clock clock) {
        this.loader = loader;
        this.ttl = ttl;
        this.clock = clock;
    }

    public Set<String> get(UUID userId) {
        Instant now = clock.instant();
        Entry entry = entries.compute(userId, (id, current) -> {
            if (current != null && current.loadedAt().plus(ttl).isAfter(now)) {
                return current;
            }
            Set<String> loaded = loader.apply(id);
            log.debug("[FingerprintCache] loaded {} fingerprints for user {}", loaded == null ? 0 : loaded.size(), id);
            return new Entry(loaded == null ? Set.of() : Set.copyOf(loaded), now);
        });
        return entry.fingerprints();
    }

    public void invalidate(UUID userId) {
        if (userId != null) entries.remove(userId);
    }
}
