package org.learningjava.biasscore.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoreMetadataTest {

    @Test
    void parse_readsAllFields() {
        ScoreMetadata m = ScoreMetadata.parse("{\"confidence\":0.8,\"explanation\":\"leans left\",\"perspective\":\"left\"}");

        assertEquals(0.8, m.confidence(), 1e-9);
        assertEquals("leans left", m.explanation());
        assertEquals("left", m.perspective());
    }

    @Test
    void parse_malformedOrMistyped_decodesToZeroConfidence() {
        assertEquals(0.0, ScoreMetadata.parse("{oops").confidence());
        assertEquals(0.0, ScoreMetadata.parse("").confidence());
        assertEquals(0.0, ScoreMetadata.parse(null).confidence());
        assertEquals(0.0, ScoreMetadata.parse("[1,2]").confidence());
        assertEquals(0.0, ScoreMetadata.parse("{\"confidence\":\"0.9\"}").confidence());
        assertEquals(0.0, ScoreMetadata.parse("{\"explanation\":\"no confidence\"}").confidence());
    }

    @Test
    void toJson_isReadableByParse() {
        ScoreMetadata m = new ScoreMetadata(0.75, "balanced", "center");

        ScoreMetadata back = ScoreMetadata.parse(m.toJson());

        assertEquals(m, back);
    }
}
