package com.esign.search.text;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.text")
public class TextProperties {
    private TextProvider provider = TextProvider.LUCENE;

    public TextProvider getProvider() {
        return provider;
    }

    public void setProvider(TextProvider provider) {
        this.provider = provider;
    }
}
