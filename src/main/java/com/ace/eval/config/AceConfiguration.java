package com.ace.eval.config;

import com.ace.eval.execution.BackoffPolicy;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.Random;

@Configuration
public class AceConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackoffPolicy backoffPolicy(AceProperties properties) {
        AceProperties.Execution execution = properties.getExecution();
        Random random = execution.getBackoffSeed() == null ? new Random() : new Random(execution.getBackoffSeed());
        return new BackoffPolicy(execution.getBackoffBase(), execution.getBackoffCap(), random);
    }

    @Bean
    public RestTemplate scoringRestTemplate(RestTemplateBuilder builder, AceProperties properties) {
        return builder
                .setConnectTimeout(properties.getScoring().getHttpTimeout())
                .setReadTimeout(properties.getScoring().getHttpTimeout())
                .build();
    }
}
