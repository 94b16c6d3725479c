package com.mediaplatform.decision.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mediaplatform.common.decision.DecisionResult;
import com.mediaplatform.common.decision.RejectionType;
import com.mediaplatform.common.decision.UpgradeStats;
import com.mediaplatform.common.decision.UpgradeStatus;
import com.mediaplatform.common.model.ReleaseCandidate;
import com.mediaplatform.common.model.ScoringProfile;
import com.mediaplatform.common.repository.MediaRepository;
import com.mediaplatform.common.scoring.ScoringOracle;
import com.mediaplatform.decision.blocklist.BlocklistEntry;
import com.mediaplatform.decision.blocklist.BlocklistReason;
import com.mediaplatform.decision.blocklist.BlocklistService;
import com.mediaplatform.decision.engine.ReleaseDecisionEngine;
import com.mediaplatform.decision.service.ReactiveReleaseDecisionService;
import com.mediaplatform.decision.support.FakeScoringOracle;
import com.mediaplatform.decision.support.InMemoryMediaRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wiring check: the host supplies the repository and scorer, the rest comes from the config.
 */
class DecisionEngineConfigTest {

    private AnnotationConfigApplicationContext context;

    @BeforeEach
    void setUp() {
        InMemoryMediaRepository repository = new InMemoryMediaRepository()
            .profile(ScoringProfile.of("p1", true, 10).asDefault())
            .movie("m1", "p1");

        context = new AnnotationConfigApplicationContext();
        context.registerBean(MediaRepository.class, () -> repository);
        context.registerBean(ScoringOracle.class, FakeScoringOracle::new);
        context.register(DecisionEngineConfig.class);
        context.refresh();
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    /** Mapper configured the way a Spring Boot host configures its own. */
    private static ObjectMapper wireMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Test
    @DisplayName("engine and reactive facade are wired")
    void beansPresent() {
        assertNotNull(context.getBean(ReleaseDecisionEngine.class));
        assertNotNull(context.getBean(ReactiveReleaseDecisionService.class));
    }

    @Test
    @DisplayName("no ObjectMapper is published, leaving the host's mapper in charge")
    void noObjectMapperBean() {
        assertThrows(NoSuchBeanDefinitionException.class, () -> context.getBean(ObjectMapper.class));
    }

    @Test
    @DisplayName("blocklist added through the service is honoured by the engine")
    void blocklistWiredThroughEngine() {
        ReleaseCandidate release = ReleaseCandidate.of("Movie.2020.1080p");
        context.getBean(BlocklistService.class).add(release, BlocklistService.Target.movie("m1"),
            BlocklistReason.MANUAL, null, "torrent", null);

        DecisionResult result = context.getBean(ReleaseDecisionEngine.class).evaluateForMovie("m1", release);

        assertEquals(RejectionType.BLOCKLISTED, result.rejectionType());
        assertEquals("Release is blocklisted (manual)", result.reason());
    }

    @Test
    @DisplayName("decision result serialises with lowercase wire codes and omits nulls")
    void wireFormat() throws Exception {
        ObjectMapper mapper = wireMapper();
        DecisionResult result = DecisionResult.rejected("Season pack would not improve quality",
            RejectionType.NO_NET_BENEFIT, UpgradeStatus.DOWNGRADE, new UpgradeStats(1, 0, 3, 0, 4));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertFalse(json.get("accepted").asBoolean());
        assertEquals("no_net_benefit", json.get("rejectionType").asText());
        assertEquals("downgrade", json.get("upgradeStatus").asText());
        assertEquals(3, json.get("upgradeStats").get("downgraded").asInt());
        assertFalse(json.has("candidateScore"));
    }

    @Test
    @DisplayName("blocklist timestamps serialise as ISO-8601")
    void blocklistTimestamps() throws Exception {
        ObjectMapper mapper = wireMapper();
        BlocklistEntry entry = context.getBean(BlocklistService.class).add(ReleaseCandidate.of("Movie.720p"),
            BlocklistService.Target.movie("m1"), BlocklistReason.IMPORT_FAILED, null, "usenet", 1);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(entry));

        assertEquals("import_failed", json.get("reason").asText());
        assertTrue(json.get("createdAt").isTextual());
        assertTrue(json.get("expiresAt").asText().endsWith("Z"));
    }
}
