package org.learningjava.biasscore.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    // ensemble fan-out, one task per model
    @Bean(name = "scoringExecutor")
    public ThreadPoolTaskExecutor scoringExecutor(ScoringProperties props) {
        int size = Math.max(1, props.getEnsemble().getPoolSize());
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(size);
        ex.setMaxPoolSize(size);
        ex.setQueueCapacity(32);
        ex.setThreadNamePrefix("scoring-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }
}
