package fr.lapetina.optimizer.cache;

import fr.lapetina.optimizer.domain.model.CachedAnalysis;

import java.time.Duration;
import java.time.Instant;

/**
 * A stored generation result.
 *
 * Mutable only through {@link #touch(Instant)}, which callers invoke while holding
 * the owning shard's lock. Content is kept either as a string or as GZIP bytes.
 */
final class CacheEntry {
    private final String fingerprint;
    private final String analysisType;
    private final String content;
    private final byte[] compressedContent;
    private final int tokensUsed;
    private final double quality;
    private final Instant createdAt;
    private final Duration ttl;

    private Instant lastAccessed;
    private long accessCount;

    CacheEntry(String fingerprint, String analysisType, String content, byte[] compressedContent,
               int tokensUsed, double quality, Instant createdAt, Duration ttl) {
        this.fingerprint = fingerprint;
        this.analysisType = analysisType;
        this.content = content;
        this.compressedContent = compressedContent;
        this.tokensUsed = tokensUsed;
        this.quality = quality;
        this.createdAt = createdAt;
        this.ttl = ttl;
        this.lastAccessed = createdAt;
        this.accessCount = 0;
    }

    String fingerprint() {
        return fingerprint;
    }

    String analysisType() {
        return analysisType;
    }

    double quality() {
        return quality;
    }

    Instant createdAt() {
        return createdAt;
    }

    Instant lastAccessed() {
        return lastAccessed;
    }

    long accessCount() {
        return accessCount;
    }

    boolean isCompressed() {
        return compressedContent != null;
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(createdAt.plus(ttl));
    }

    void touch(Instant now) {
        accessCount++;
        if (now.isAfter(lastAccessed)) {
            lastAccessed = now;
        }
    }

    /**
     * Builds the public view. Decompression happens here, so call it outside the shard lock
     * on a {@link Snapshot}.
     */
    Snapshot snapshot() {
        return new Snapshot(this, lastAccessed, accessCount);
    }

    /**
     * Entry state captured under the lock, safe to materialize afterwards.
     */
    record Snapshot(CacheEntry entry, Instant lastAccessed, long accessCount) {
        CachedAnalysis toView() {
            String text = entry.isCompressed() ? Compression.gunzip(entry.compressedContent) : entry.content;
            return new CachedAnalysis(
                    entry.fingerprint,
                    entry.analysisType,
                    text,
                    entry.tokensUsed,
                    entry.quality,
                    entry.createdAt,
                    lastAccessed,
                    accessCount,
                    entry.ttl,
                    entry.isCompressed()
            );
        }
    }
}
