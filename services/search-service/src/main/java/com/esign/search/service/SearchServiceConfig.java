package com.esign.search.service;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SearchFeatureProperties.class)
public class SearchServiceConfig {
}
