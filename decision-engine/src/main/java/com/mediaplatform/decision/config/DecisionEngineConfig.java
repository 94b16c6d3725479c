package com.mediaplatform.decision.config;

import com.mediaplatform.common.blocklist.BlocklistGate;
import com.mediaplatform.common.repository.MediaRepository;
import com.mediaplatform.common.scoring.ScoringOracle;
import com.mediaplatform.decision.engine.ReleaseDecisionEngine;
import com.mediaplatform.decision.logger.DecisionFlowLogger;
import com.mediaplatform.decision.profile.ProfileResolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the decision engine. The host application supplies the {@link MediaRepository}
 * and {@link ScoringOracle} beans; everything else is provided here or picked up by
 * component scanning.
 *
 * <p>No {@code ObjectMapper} is published here: result records carry their wire names as
 * Jackson annotations and serialise with the host's mapper.
 */
@Configuration
@ComponentScan(basePackages = "com.mediaplatform.decision")
public class DecisionEngineConfig {

    @Value("${decision.allow-sidegrade-default:false}")
    private boolean allowSidegradeDefault;

    @Bean
    public ReleaseDecisionEngine releaseDecisionEngine(MediaRepository mediaRepository,
                                                       ScoringOracle scoringOracle,
                                                       BlocklistGate blocklistGate,
                                                       ProfileResolver profileResolver,
                                                       DecisionFlowLogger decisionFlowLogger) {
        return new ReleaseDecisionEngine(mediaRepository, scoringOracle, blocklistGate,
            profileResolver, decisionFlowLogger, allowSidegradeDefault);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
