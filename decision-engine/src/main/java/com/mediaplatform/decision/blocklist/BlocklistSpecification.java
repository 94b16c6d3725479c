package com.mediaplatform.decision.blocklist;

import com.mediaplatform.common.blocklist.BlocklistGate;
import com.mediaplatform.common.blocklist.BlocklistScope;
import com.mediaplatform.common.blocklist.BlocklistVerdict;
import com.mediaplatform.common.exception.CollaboratorException;
import com.mediaplatform.common.exception.CollaboratorException.Collaborator;
import com.mediaplatform.common.model.ReleaseCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link BlocklistGate} backed by a {@link BlocklistStore}.
 *
 * <p>Only entries of the same movie or series are considered, and expired entries are
 * ignored (they are purged separately by {@link BlocklistService#purgeExpired()}).
 */
@Component
public class BlocklistSpecification implements BlocklistGate {

    private static final Logger log = LoggerFactory.getLogger(BlocklistSpecification.class);

    private final BlocklistStore store;
    private final Clock clock;

    public BlocklistSpecification(BlocklistStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public BlocklistVerdict isSatisfied(ReleaseCandidate candidate, BlocklistScope scope) {
        List<BlocklistEntry> entries;
        try {
            entries = scope.isMovie()
                ? store.findByMovieId(scope.movieId())
                : store.findBySeriesId(scope.seriesId());
        } catch (RuntimeException e) {
            throw new CollaboratorException(Collaborator.BLOCKLIST_STORE, "Lookup failed for "
                + (scope.isMovie() ? "movieId=" + scope.movieId() : "seriesId=" + scope.seriesId()), e);
        }

        Instant now = clock.instant();
        Optional<BlocklistEntry> match = entries.stream()
            .filter(entry -> !entry.isExpired(now))
            .filter(entry -> entry.matches(candidate))
            .findFirst();

        if (match.isEmpty()) {
            return BlocklistVerdict.accept();
        }
        BlocklistEntry entry = match.get();
        log.debug("[Blocklist] Release rejected. title=\"{}\" entryId={} reason={}",
            candidate.title(), entry.id(), entry.reason().code());
        return BlocklistVerdict.reject("Release is blocklisted (" + entry.reason().code() + ")");
    }
}
