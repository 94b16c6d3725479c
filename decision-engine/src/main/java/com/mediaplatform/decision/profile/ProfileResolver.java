package com.mediaplatform.decision.profile;

import com.mediaplatform.common.model.ScoringProfile;
import com.mediaplatform.common.repository.MediaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the effective scoring profile of a movie or series.
 *
 * <h3>Fallback chain (first hit wins)</h3>
 * <ol>
 *   <li>{@link FallbackTier#ASSIGNED}: the entity's own profile id, when set and present</li>
 *   <li>{@link FallbackTier#DEFAULT}: the profile flagged as default</li>
 *   <li>{@link FallbackTier#ANY}: the first profile that exists at all</li>
 * </ol>
 * A profile id that is set but missing (deleted profile) logs a warning and falls through
 * instead of failing the evaluation.
 */
@Component
public class ProfileResolver {

    private static final Logger log = LoggerFactory.getLogger(ProfileResolver.class);

    public enum FallbackTier {
        ASSIGNED,
        DEFAULT,
        ANY
    }

    private static final List<FallbackTier> CHAIN =
        List.of(FallbackTier.ASSIGNED, FallbackTier.DEFAULT, FallbackTier.ANY);

    private final MediaRepository repository;

    public ProfileResolver(MediaRepository repository) {
        this.repository = repository;
    }

    /**
     * @param assignedProfileId the entity's profile id; may be null
     * @return the effective profile, or empty when no profile exists anywhere
     */
    public Optional<ScoringProfile> resolve(String assignedProfileId) {
        for (FallbackTier tier : CHAIN) {
            Optional<ScoringProfile> profile = lookup(tier, assignedProfileId);
            if (profile.isPresent()) {
                return profile;
            }
        }
        return Optional.empty();
    }

    private Optional<ScoringProfile> lookup(FallbackTier tier, String assignedProfileId) {
        return switch (tier) {
            case ASSIGNED -> assignedProfile(assignedProfileId);
            case DEFAULT  -> repository.getDefaultProfile();
            case ANY      -> anyProfile();
        };
    }

    private Optional<ScoringProfile> assignedProfile(String assignedProfileId) {
        if (assignedProfileId == null || assignedProfileId.isBlank()) {
            return Optional.empty();
        }
        Optional<ScoringProfile> assigned = repository.getProfileById(assignedProfileId);
        if (assigned.isEmpty()) {
            log.warn("[ProfileResolver] Specified profile not found, falling back. profileId={}", assignedProfileId);
        }
        return assigned;
    }

    private Optional<ScoringProfile> anyProfile() {
        Optional<ScoringProfile> any = repository.getAnyProfile();
        any.ifPresent(p ->
            log.warn("[ProfileResolver] No default profile set, using first available. profileId={}", p.id()));
        return any;
    }
}
