package com.novaware.catalog.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
public class PipelineConfig {

    /** Shared random source for stock splits, review top-up and sampling. */
    @Bean
    public Random pipelineRandom(PipelineProperties pipelineProperties) {
        Long seed = pipelineProperties.getRandomSeed();
        return seed != null ? new Random(seed) : new Random();
    }
}
