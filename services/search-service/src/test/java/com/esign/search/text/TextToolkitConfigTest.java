package com.esign.search.text;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextToolkitConfigTest {

    private final TextToolkitConfig config = new TextToolkitConfig();

    @Test
    void defaultsToLucene() {
        assertThat(config.textToolkit(new TextProperties())).isInstanceOf(LuceneTextToolkit.class);
    }

    @Test
    void basicProviderIsSelectable() {
        TextProperties properties = new TextProperties();
        properties.setProvider(TextProvider.BASIC);

        assertThat(config.textToolkit(properties)).isInstanceOf(BasicTextToolkit.class);
    }
}
