package com.afsun.omop2graph.config;

import com.afsun.omop2graph.cli.ConsoleConfirmationPrompt;
import com.afsun.omop2graph.core.resolver.LabelResolver;
import com.afsun.omop2graph.core.transform.ArtifactStore;
import com.afsun.omop2graph.loader.ConfirmationPrompt;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MigrationConfiguration {

    @Bean
    public LabelResolver labelResolver() {
        return new LabelResolver();
    }

    @Bean
    public ArtifactStore artifactStore(ObjectMapper objectMapper) {
        return new ArtifactStore(objectMapper);
    }

    @Bean
    public ConfirmationPrompt confirmationPrompt() {
        return new ConsoleConfirmationPrompt(System.in, System.out);
    }
}
