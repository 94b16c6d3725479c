package com.mediaplatform.decision.blocklist;

import com.mediaplatform.common.model.ReleaseCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Writes to the blocklist: manual additions, failed downloads, purging of expired entries.
 *
 * <h3>Expiry</h3>
 * <ul>
 *   <li>explicit {@code expiresInHours} &gt; 0 → expires after that many hours</li>
 *   <li>otherwise {@code decision.blocklist.default-expiry-hours} (0 = permanent)</li>
 *   <li>{@link #addUnavailable} uses {@code decision.blocklist.unavailable-expiry-hours}
 *       (72 by default) in case the release becomes available later</li>
 * </ul>
 */
@Service
public class BlocklistService {

    private static final Logger log = LoggerFactory.getLogger(BlocklistService.class);

    private final BlocklistStore store;
    private final Clock clock;
    private final int defaultExpiryHours;
    private final int unavailableExpiryHours;

    public BlocklistService(BlocklistStore store, Clock clock,
                            @Value("${decision.blocklist.default-expiry-hours:0}") int defaultExpiryHours,
                            @Value("${decision.blocklist.unavailable-expiry-hours:72}") int unavailableExpiryHours) {
        this.store = store;
        this.clock = clock;
        this.defaultExpiryHours = defaultExpiryHours;
        this.unavailableExpiryHours = unavailableExpiryHours;
    }

    /**
     * Where a blocklisted release applies. Exactly one of movieId / seriesId is expected.
     */
    public record Target(String movieId, String seriesId, Set<String> episodeIds) {

        public static Target movie(String movieId) {
            return new Target(movieId, null, Set.of());
        }

        public static Target episodes(String seriesId, Set<String> episodeIds) {
            return new Target(null, seriesId, episodeIds);
        }
    }

    /**
     * @param expiresInHours null or ≤ 0 applies the configured default
     */
    public BlocklistEntry add(ReleaseCandidate release, Target target, BlocklistReason reason,
                              String message, String protocol, Integer expiresInHours) {
        int hours = expiresInHours != null && expiresInHours > 0 ? expiresInHours : defaultExpiryHours;
        Instant now = clock.instant();
        Instant expiresAt = hours > 0 ? now.plus(Duration.ofHours(hours)) : null;

        BlocklistEntry entry = store.save(new BlocklistEntry(
            UUID.randomUUID().toString(), release.title(), release.infoHash(), release.indexerId(),
            target.movieId(), target.seriesId(), target.episodeIds(), reason, message,
            release.size(), protocol, now, expiresAt));

        log.info("[Blocklist] Added. title=\"{}\" reason={} movieId={} seriesId={} expiresAt={}",
            entry.title(), reason.code(), entry.movieId(), entry.seriesId(),
            expiresAt != null ? expiresAt : "never");
        return entry;
    }

    /** Blocklists a release its source reported as unavailable, with the short expiry. */
    public BlocklistEntry addUnavailable(ReleaseCandidate release, Target target, String protocol, String message) {
        return add(release, target, BlocklistReason.DOWNLOAD_FAILED, message, protocol, unavailableExpiryHours);
    }

    public boolean remove(String entryId) {
        boolean removed = store.deleteById(entryId);
        if (removed) {
            log.info("[Blocklist] Removed. entryId={}", entryId);
        }
        return removed;
    }

    /** @return number of expired entries removed */
    public int purgeExpired() {
        int purged = store.deleteExpired(clock.instant());
        if (purged > 0) {
            log.info("[Blocklist] Purged expired entries. count={}", purged);
        }
        return purged;
    }
}
