package me.golemcore.mind.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.mind.domain.model.PropagationWeights;
import me.golemcore.mind.domain.model.SimilarityThresholds;
import me.golemcore.mind.domain.model.SleepComputeConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MindConfigurationTest {

    @Test
    void defaultPropertiesMatchEngineDefaults() {
        SleepComputeConfig config = MindConfiguration.toSleepComputeConfig(new MindProperties().getSleep());

        assertEquals(SleepComputeConfig.defaults(), config);
    }

    @Test
    void sleepPropertiesAreConvertedToDurations() {
        MindProperties properties = new MindProperties();
        properties.getSleep().setTimeBudgetMs(1_500);
        properties.getSleep().setSessionTtlHours(6);
        properties.getSleep().setMinObservationsPerRun(1);

        SleepComputeConfig config = new MindConfiguration(properties).sleepComputeConfig();

        assertEquals(Duration.ofMillis(1_500), config.getTimeBudget());
        assertEquals(Duration.ofHours(6), config.getSessionTtl());
        assertEquals(1, config.getMinObservationsPerRun());
    }

    @Test
    void feedbackAndSimilarityDefaults() {
        MindConfiguration configuration = new MindConfiguration(new MindProperties());

        assertEquals(PropagationWeights.defaults(), configuration.propagationWeights());
        assertEquals(SimilarityThresholds.defaults(), configuration.similarityThresholds());
    }

    @Test
    void objectMapperWritesIsoInstantsAndIgnoresUnknownFields() throws Exception {
        ObjectMapper mapper = MindConfiguration.objectMapper();

        String json = mapper.writeValueAsString(new Stamp(Instant.parse("2026-03-01T09:00:00Z")));
        Stamp parsed = mapper.readValue("{\"at\":\"2026-03-01T09:00:00Z\",\"extra\":1}", Stamp.class);

        assertEquals("{\"at\":\"2026-03-01T09:00:00Z\"}", json);
        assertEquals(Instant.parse("2026-03-01T09:00:00Z"), parsed.at());
    }

    record Stamp(Instant at) {
    }
}
