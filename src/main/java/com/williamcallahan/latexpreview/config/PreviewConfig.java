package com.williamcallahan.latexpreview.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans for the preview pipeline.
 */
@Configuration
public class PreviewConfig {

    /**
     * Creates preview configuration.
     */
    public PreviewConfig() {}

    /**
     * Clock used to resolve {@code \today} in document dates.
     *
     * @return system clock in the default zone
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
