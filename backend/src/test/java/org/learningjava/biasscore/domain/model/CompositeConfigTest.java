package org.learningjava.biasscore.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CompositeConfigTest {

    private static CompositeConfig cfg(double minScore, double maxScore, double minConf, double maxConf,
                                       List<ModelPerspective> models) {
        return new CompositeConfig(null, null, minScore, maxScore, 0.0, null, null, minConf, maxConf, models);
    }

    @Test
    void nullFields_getDefaults() {
        CompositeConfig c = cfg(-1, 1, 0, 0, null);

        assertEquals(CompositeConfig.Formula.AVERAGE, c.formula());
        assertEquals(CompositeConfig.InvalidHandling.DEFAULT, c.handleInvalid());
        assertEquals(CompositeConfig.ConfidenceMethod.COUNT_VALID, c.confidenceMethod());
        assertTrue(c.models().isEmpty());
        assertEquals(1.0, c.weightOf(Perspective.LEFT));
    }

    @Test
    void validate_rejectsInvertedBoundsAndEmptyModels() {
        List<ModelPerspective> models = List.of(new ModelPerspective("m", "left"));

        assertThrows(IllegalStateException.class, () -> cfg(1, -1, 0, 1, models).validate());
        assertThrows(IllegalStateException.class, () -> cfg(-1, 1, 0.9, 0.1, models).validate());
        assertThrows(IllegalStateException.class, () -> cfg(-1, 1, 0, 1, List.of()).validate());
        assertDoesNotThrow(() -> cfg(-1, 1, 0, 0, models).validate());
    }

    @Test
    void confidenceBounds_onlyCountWhenMaxAboveMin() {
        assertFalse(cfg(-1, 1, 0, 0, null).hasConfidenceBounds());
        assertTrue(cfg(-1, 1, 0.1, 0.9, null).hasConfidenceBounds());
    }

    @Test
    void json_usesSnakeCaseKeysAndLowerCaseEnums() throws Exception {
        String json = """
            {"formula":"weighted","weights":{"left":2.0},"min_score":-1,"max_score":1,
             "default_missing":0.1,"handle_invalid":"ignore","confidence_method":"spread",
             "min_confidence":0.2,"max_confidence":0.8,
             "models":[{"modelName":"a/b","perspective":"right","weight":1.5,"url":"http://x"}],
             "unknown_key":true}
            """;

        CompositeConfig c = new ObjectMapper().readValue(json, CompositeConfig.class);

        assertEquals(CompositeConfig.Formula.WEIGHTED, c.formula());
        assertEquals(Map.of("left", 2.0), c.weights());
        assertEquals(0.1, c.defaultMissing(), 1e-9);
        assertEquals(CompositeConfig.InvalidHandling.IGNORE, c.handleInvalid());
        assertEquals(CompositeConfig.ConfidenceMethod.SPREAD, c.confidenceMethod());
        assertEquals("a/b", c.models().get(0).modelName());
        assertEquals(1.5, c.models().get(0).weight(), 1e-9);
    }
}
