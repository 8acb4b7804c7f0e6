package com.esign.search.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TextProperties.class)
public class TextToolkitConfig {
    private static final Logger log = LoggerFactory.getLogger(TextToolkitConfig.class);

    @Bean
    public TextToolkit textToolkit(TextProperties properties) {
        TextProvider provider = properties.getProvider() == null ? TextProvider.LUCENE : properties.getProvider();
        log.info("text toolkit provider={}", provider);
        return switch (provider) {
            case LUCENE -> new LuceneTextToolkit();
            case BASIC -> new BasicTextToolkit();
        };
    }
}
