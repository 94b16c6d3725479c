package com.mediaplatform.decision.blocklist;

import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Process-local {@link BlocklistStore}. Entries are lost on restart; hosts that need
 * durability provide their own store bean.
 */
@Repository
public class InMemoryBlocklistStore implements BlocklistStore {

    private final Map<String, BlocklistEntry> entries = new ConcurrentHashMap<>();

    @Override
    public List<BlocklistEntry> findByMovieId(String movieId) {
        return find(entry -> movieId.equals(entry.movieId()));
    }

    @Override
    public List<BlocklistEntry> findBySeriesId(String seriesId) {
        return find(entry -> seriesId.equals(entry.seriesId()));
    }

    @Override
    public BlocklistEntry save(BlocklistEntry entry) {
        entries.put(entry.id(), entry);
        return entry;
    }

    @Override
    public boolean deleteById(String id) {
        return entries.remove(id) != null;
    }

    @Override
    public int deleteExpired(Instant now) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        return before - entries.size();
    }

    private List<BlocklistEntry> find(Predicate<BlocklistEntry> filter) {
        return entries.values().stream()
            .filter(filter)
            .sorted(Comparator.comparing(BlocklistEntry::createdAt))
            .toList();
    }
}
