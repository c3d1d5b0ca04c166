package org.learningjava.biasscore.domain.service.prompting;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders a prompt as {@code template + "\n" + examples + "\nArticle:\n" + content}.
 * The examples are few-shot answers in the JSON shape the provider adapter parses first.
 */
@Component
public class DefaultPromptBuilder implements PromptBuilder {

    private static final String JSON_ONLY =
            "Respond ONLY with a valid JSON object containing 'score', 'explanation', and 'confidence'. "
                    + "Do not include any other text or formatting.";

    @Override
    public String build(PromptVariant variant, String articleContent) {
        String template = switch (variant) {
            case DEFAULT -> """
                Please analyze the political bias of the following article on a scale from -1.0 (strongly left) \
                to 1.0 (strongly right). %s""".formatted(JSON_ONLY);

            case LEFT_FOCUS -> """
                From a progressive or left-leaning perspective, analyze the political bias of the following article \
                on a scale from -1.0 (strongly left) to 1.0 (strongly right).
                %s""".formatted(JSON_ONLY);

            case CENTER_FOCUS -> """
                From a centrist or neutral perspective, analyze the political bias of the following article \
                on a scale from -1.0 (strongly left) to 1.0 (strongly right).
                %s""".formatted(JSON_ONLY);

            case RIGHT_FOCUS -> """
                From a conservative or right-leaning perspective, analyze the political bias of the following article \
                on a scale from -1.0 (strongly left) to 1.0 (strongly right).
                %s""".formatted(JSON_ONLY);
        };

        return template + "\n" + String.join("\n", examples(variant)) + "\nArticle:\n"
                + (articleContent == null ? "" : articleContent);
    }

    private static List<String> examples(PromptVariant variant) {
        return switch (variant) {
            case DEFAULT -> List.of(
                    "{\"score\": -1.0, \"explanation\": \"Strongly left-leaning language\", \"confidence\": 0.9}",
                    "{\"score\": 0.0, \"explanation\": \"Neutral reporting\", \"confidence\": 0.95}",
                    "{\"score\": 1.0, \"explanation\": \"Strongly right-leaning language\", \"confidence\": 0.9}");
            case LEFT_FOCUS -> List.of(
                    "{\"score\": -1.0, \"explanation\": \"Strongly aligns with progressive viewpoints\", \"confidence\": 0.9}",
                    "{\"score\": 0.0, \"explanation\": \"Balanced or neutral reporting\", \"confidence\": 0.95}",
                    "{\"score\": 1.0, \"explanation\": \"Strongly opposes progressive viewpoints\", \"confidence\": 0.9}");
            case CENTER_FOCUS -> List.of(
                    "{\"score\": -1.0, \"explanation\": \"Clearly favors left-leaning positions\", \"confidence\": 0.9}",
                    "{\"score\": 0.0, \"explanation\": \"Appears balanced without clear bias\", \"confidence\": 0.95}",
                    "{\"score\": 1.0, \"explanation\": \"Clearly favors right-leaning positions\", \"confidence\": 0.9}");
            case RIGHT_FOCUS -> List.of(
                    "{\"score\": -1.0, \"explanation\": \"Strongly opposes conservative viewpoints\", \"confidence\": 0.9}",
                    "{\"score\": 0.0, \"explanation\": \"Balanced or neutral reporting\", \"confidence\": 0.95}",
                    "{\"score\": 1.0, \"explanation\": \"Strongly aligns with conservative viewpoints\", \"confidence\": 0.9}");
        };
    }
}
