package com.example.demo.lettergen.config;

import com.example.demo.lettergen.processor.ConditionalBlockEliminator;
import com.example.demo.lettergen.util.PlaceholderNames;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the pieces of the letter pipeline that depend on {@link LetterTemplateProperties}.
 */
@Configuration
public class LetterGenConfiguration {

    @Bean
    public Clock letterClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public PlaceholderNames placeholderNames(LetterTemplateProperties properties) {
        return new PlaceholderNames(properties.getNameAliases());
    }

    @Bean
    public ConditionalBlockEliminator conditionalBlockEliminator(LetterTemplateProperties properties) {
        return new ConditionalBlockEliminator(properties.getBlockScanMode());
    }
}
