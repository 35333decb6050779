package com.tapmap.fountains.infrastructure.persistence;

import com.tapmap.fountains.application.port.out.FountainStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for wiring JPA repositories to application ports.
 * This adapter layer bridges infrastructure (JPA) with application ports.
 */
@Configuration
public class PersistenceAdapterConfig {

    /**
     * Wire the JPA repository to the FountainStore port.
     */
    @Bean
    public FountainStore fountainStore(FountainJpaRepository jpaRepository) {
        return new FountainStoreAdapter(jpaRepository);
    }
}
