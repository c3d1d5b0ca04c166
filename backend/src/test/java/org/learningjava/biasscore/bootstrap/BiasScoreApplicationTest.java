package org.learningjava.biasscore.bootstrap;

import org.junit.jupiter.api.Test;
import org.learningjava.biasscore.application.port.ArticleSourcePort;
import org.learningjava.biasscore.application.port.ScoringProviderPort;
import org.learningjava.biasscore.application.progress.ProgressTracker;
import org.learningjava.biasscore.application.usecase.ArticleScoringUseCase;
import org.learningjava.biasscore.domain.model.CompositeConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the whole context against a throwaway Postgres with the test profile.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class BiasScoreApplicationTest {

    @Container
    static PostgreSQLContainer<?> pg = new PostgreSQLContainer<>("postgres:16");

    @DynamicPropertySource
    static void datasource(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", pg::getJdbcUrl);
        r.add("spring.datasource.username", pg::getUsername);
        r.add("spring.datasource.password", pg::getPassword);
    }

    @Autowired CompositeConfig compositeConfig;
    @Autowired ProgressTracker progressTracker;
    @Autowired ScoringProviderPort provider;
    @Autowired ArticleSourcePort articleSource;
    @Autowired ArticleScoringUseCase scoring;

    @Test
    void contextLoads_withTestProfile() {
        assertEquals(CompositeConfig.Formula.WEIGHTED, compositeConfig.formula());
        assertEquals(3, compositeConfig.models().size());
        assertFalse(progressTracker.isRunning());
        assertEquals("openrouter", provider.provider());
        assertNotNull(scoring);
        assertTrue(articleSource.findUnscored(5).isEmpty());
    }
}
