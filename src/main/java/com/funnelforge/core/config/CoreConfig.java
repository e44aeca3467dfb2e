package com.funnelforge.core.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

@Configuration
public class CoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Randomness for Thompson Sampling draws. */
    @Bean
    @ConditionalOnMissingBean
    public Random banditRandom() {
        return new Random();
    }
}
