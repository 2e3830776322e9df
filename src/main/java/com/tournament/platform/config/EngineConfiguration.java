package com.tournament.platform.config;

import com.tournament.platform.service.TableAssigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

@Configuration
public class EngineConfiguration {
    
    private static final Logger logger = LoggerFactory.getLogger(EngineConfiguration.class);
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    /**
     * Source of randomness for table shuffles and tournament codes. A configured seed makes
     * random assignments reproducible.
     */
    @Bean
    public Random tournamentRandom(@Value("${tournament.assignment.seed:}") String seed) {
        if (seed == null || seed.isBlank()) {
            return new SecureRandom();
        }
        logger.info("Using seeded random source ({})", seed.trim());
        return new Random(Long.parseLong(seed.trim()));
    }
    
    @Bean
    public TableAssigner tableAssigner(Random tournamentRandom) {
        return new TableAssigner(tournamentRandom);
    }
}
