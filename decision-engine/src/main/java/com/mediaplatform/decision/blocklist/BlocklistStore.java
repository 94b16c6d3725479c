package com.mediaplatform.decision.blocklist;

import java.time.Instant;
import java.util.List;

/**
 * Storage for {@link BlocklistEntry} records. Implementations must be thread-safe.
 */
public interface BlocklistStore {

    List<BlocklistEntry> findByMovieId(String movieId);

    List<BlocklistEntry> findBySeriesId(String seriesId);

    BlocklistEntry save(BlocklistEntry entry);

    boolean deleteById(String id);

    /** @return number of entries removed */
    int deleteExpired(Instant now);
}
