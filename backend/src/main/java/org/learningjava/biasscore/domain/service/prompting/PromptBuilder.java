package org.learningjava.biasscore.domain.service.prompting;

public interface PromptBuilder {
    String build(PromptVariant variant, String articleContent);
}
