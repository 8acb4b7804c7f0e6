package com.esign.search.analytics;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsConfig {

    @Bean
    @ConditionalOnMissingBean
    public AnalyticsStore analyticsStore() {
        return new InMemoryAnalyticsStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public PersonalizationProfileStore personalizationProfileStore() {
        return new InMemoryPersonalizationProfileStore();
    }

    /**
     * One thread, so flushes and deferred profile writes run in submission order. Tasks submitted
     * during context close still run; the pool is torn down after the buffer's final flush.
     */
    @Bean
    public ThreadPoolTaskScheduler analyticsTaskScheduler(AnalyticsProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("analytics-flush-");
        scheduler.setDaemon(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationMillis(properties.getShutdownTimeout().toMillis());
        return scheduler;
    }
}
