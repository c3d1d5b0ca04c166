package org.learningjava.biasscore.domain.service.prompting;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefaultPromptBuilderTest {

    private final DefaultPromptBuilder builder = new DefaultPromptBuilder();

    @Test
    void build_endsWithArticleSection() {
        String p = builder.build(PromptVariant.DEFAULT, "The senate voted today.");

        assertTrue(p.endsWith("\nArticle:\nThe senate voted today."));
        assertTrue(p.contains("-1.0 (strongly left)"));
        assertTrue(p.contains("{\"score\": 0.0, \"explanation\": \"Neutral reporting\", \"confidence\": 0.95}"));
    }

    @Test
    void build_everyVariantAsksForJson() {
        for (PromptVariant v : PromptVariant.values()) {
            String p = builder.build(v, "x");
            assertTrue(p.contains("Respond ONLY with a valid JSON object"), v.id());
        }
        assertTrue(builder.build(PromptVariant.RIGHT_FOCUS, "x").contains("conservative"));
    }

    @Test
    void build_nullContentRendersEmptyArticle() {
        assertTrue(builder.build(PromptVariant.LEFT_FOCUS, null).endsWith("\nArticle:\n"));
    }
}
