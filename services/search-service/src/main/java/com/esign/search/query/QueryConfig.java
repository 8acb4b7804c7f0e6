package com.esign.search.query;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(QueryProperties.class)
public class QueryConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock searchClock() {
        return Clock.systemUTC();
    }
}
