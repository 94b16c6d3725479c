package com.mediaplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A file currently on disk for a movie or for one or more episodes.
 *
 * <p>An episode file may cover several episodes (multi-episode files); movie files carry
 * an empty {@code episodeIds} set. The data layer does not guarantee a single file per
 * episode, so callers must handle zero, one, or many matches.
 *
 * @param id           file identifier
 * @param sceneName    original release name, if known
 * @param relativePath path relative to the media root folder
 * @param infoHash     torrent info hash, if the file came from a torrent
 * @param episodeIds   episodes this file covers
 */
public record ExistingFile(
    @JsonProperty("id") String id,
    @JsonProperty("sceneName") String sceneName,
    @JsonProperty("relativePath") String relativePath,
    @JsonProperty("infoHash") String infoHash,
    @JsonProperty("episodeIds") Set<String> episodeIds
) {
    public ExistingFile {
        Objects.requireNonNull(relativePath, "relativePath");
        episodeIds = episodeIds == null ? Set.of() : Set.copyOf(episodeIds);
    }

    public static ExistingFile forMovie(String id, String sceneName, String relativePath, String infoHash) {
        return new ExistingFile(id, sceneName, relativePath, infoHash, Set.of());
    }

    public static ExistingFile forEpisodes(String id, String sceneName, String relativePath,
                                           String infoHash, Set<String> episodeIds) {
        return new ExistingFile(id, sceneName, relativePath, infoHash, episodeIds);
    }

    /** The string fed to the scorer: scene name when known, else the relative path. */
    public String identity() {
        return sceneName != null && !sceneName.isBlank() ? sceneName : relativePath;
    }

    public boolean covers(String episodeId) {
        return episodeIds.contains(episodeId);
    }

    /** True when both sides carry an info hash and they are equal ignoring case. */
    public boolean hasSameHash(String otherHash) {
        if (infoHash == null || infoHash.isBlank() || otherHash == null || otherHash.isBlank()) {
            return false;
        }
        return infoHash.toLowerCase(Locale.ROOT).equals(otherHash.toLowerCase(Locale.ROOT));
    }
}
