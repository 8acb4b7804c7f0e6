package com.esign.search.ranking;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({RankingProperties.class, SuggestionProperties.class})
public class RankingConfig {
}
