package com.mediaplatform.common.repository;

import com.mediaplatform.common.model.Episode;
import com.mediaplatform.common.model.ExistingFile;
import com.mediaplatform.common.model.Movie;
import com.mediaplatform.common.model.ScoringProfile;
import com.mediaplatform.common.model.Series;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to library entities, their files and scoring profiles.
 *
 * <p>"Not found" is always {@link Optional#empty()} or an empty list, never {@code null}.
 * Implementations may throw unchecked exceptions on infrastructure failure; the decision
 * engine converts those into {@code error} rejections.
 */
public interface MediaRepository {

    Optional<Movie> getMovieWithProfile(String movieId);

    Optional<ExistingFile> getMovieFile(String movieId);

    Optional<Episode> getEpisodeWithSeriesAndProfile(String episodeId);

    Optional<Series> getSeriesWithProfile(String seriesId);

    /**
     * All episode files of a series. Callers filter by episode-id membership; a file
     * covering several episodes is returned once.
     */
    List<ExistingFile> getEpisodeFilesBySeries(String seriesId);

    List<Episode> getEpisodesBySeason(String seriesId, int seasonNumber);

    List<Episode> getEpisodesBySeries(String seriesId);

    /** Episodes whose id is in {@code episodeIds}; unknown ids are silently skipped. */
    List<Episode> getEpisodesByIds(Collection<String> episodeIds);

    Optional<ScoringProfile> getProfileById(String profileId);

    /** The profile flagged as default, if any. */
    Optional<ScoringProfile> getDefaultProfile();

    /** Any existing profile, used as the last fallback tier. */
    Optional<ScoringProfile> getAnyProfile();
}
