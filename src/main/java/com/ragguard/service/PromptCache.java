package com.ragguard.service;

import com.ragguard.model.PromptArtifact;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process cache of prompt artifacts, scoped by caller groups.
 *
 * <p>The key covers the template and the sorted group set, so callers with different
 * groups never share an entry. Expired entries are treated as absent and removed on read.
 */
@Slf4j
public class PromptCache {

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public PromptCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * sha256 of the template content, a pipe, and the sorted groups joined with commas
     */
    public static String keyFor(String templateContent, Collection<String> groups) {
        String scope = groups == null ? "" : String.join(",", new TreeSet<>(groups));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((templateContent + "|" + scope).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public Optional<PromptArtifact> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (isExpired(entry)) {
            entries.remove(key, entry);
            misses.incrementAndGet();
            log.debug("Prompt cache entry expired: {}", key);
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.getPayload());
    }

    public void put(String key, PromptArtifact payload) {
        entries.put(key, new CacheEntry(key, payload, clock.instant()));
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    private boolean isExpired(CacheEntry entry) {
        return !clock.instant().isBefore(entry.getCreatedAt().plus(ttl));
    }

    @Value
    static class CacheEntry {
        String key;
        PromptArtifact payload;
        Instant createdAt;
    }
}
