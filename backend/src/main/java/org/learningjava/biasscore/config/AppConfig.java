package org.learningjava.biasscore.config;

import okhttp3.OkHttpClient;
import org.learningjava.biasscore.application.cache.ResponseCache;
import org.learningjava.biasscore.application.port.ArticleSourcePort;
import org.learningjava.biasscore.application.port.ArticleViewCache;
import org.learningjava.biasscore.application.port.ScoreStorePort;
import org.learningjava.biasscore.application.port.ScoringProviderPort;
import org.learningjava.biasscore.application.progress.ProgressTracker;
import org.learningjava.biasscore.domain.model.CompositeConfig;
import org.learningjava.biasscore.infrastructure.adapter.out.cache.CaffeineArticleViewCache;
import org.learningjava.biasscore.infrastructure.adapter.out.jdbc.JdbcArticleSourceAdapter;
import org.learningjava.biasscore.infrastructure.adapter.out.jdbc.JdbcScoreStoreAdapter;
import org.learningjava.biasscore.infrastructure.adapter.out.openrouter.OpenRouterScoringAdapter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class AppConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    CompositeConfig compositeConfig(ResourceLoader resources, ScoringProperties props) {
        return new CompositeConfigLoader(resources).load(props.getCompositeConfig());
    }

    //objects with external dependencies
    @Bean
    ScoringProviderPort scoringProvider(
            ScoringProperties props,
            @Value("${LLM_API_KEY:}") String envKey,
            @Value("${LLM_API_KEY_FILE:/run/secrets/llm_api_key}") String keyFile,
            @Value("${LLM_API_KEY_SECONDARY:}") String envBackupKey,
            @Value("${LLM_API_KEY_SECONDARY_FILE:/run/secrets/llm_api_key_secondary}") String backupKeyFile) {
        ScoringProperties.Provider p = props.getProvider();
        Duration timeout = p.getTimeout();
        OkHttpClient http = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout)
                .build();
        return new OpenRouterScoringAdapter(
                http, null,
                OpenRouterScoringAdapter.resolveApiKey(envKey, keyFile),
                OpenRouterScoringAdapter.resolveApiKey(envBackupKey, backupKeyFile),
                p.getBaseUrl(), p.getReferer(), p.getTitle(),
                p.getMaxTokens(), p.getTemperature(),
                p.getMaxRetries(), p.getBackoff(), null);
    }

    @Bean
    ScoreStorePort scoreStore(DataSource dataSource) {
        JdbcScoreStoreAdapter store = new JdbcScoreStoreAdapter(dataSource);
        store.ensureSchema();
        return store;
    }

    @Bean
    ArticleSourcePort articleSource(DataSource dataSource) {
        return new JdbcArticleSourceAdapter(dataSource);
    }

    @Bean
    ArticleViewCache articleViewCache(ScoringProperties props) {
        return new CaffeineArticleViewCache(props.getViewCache().getTtl(), props.getViewCache().getMaximumSize());
    }

    @Bean
    ResponseCache responseCache() {
        return new ResponseCache();
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    ProgressTracker progressTracker(Clock clock, ScoringProperties props) {
        return new ProgressTracker(clock,
                props.getProgress().getCleanupInterval(),
                props.getProgress().isCleanupEnabled());
    }
}
