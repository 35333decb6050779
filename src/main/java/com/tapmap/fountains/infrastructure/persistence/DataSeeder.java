package com.tapmap.fountains.infrastructure.persistence;

import com.tapmap.fountains.domain.model.Fountain;
import com.tapmap.fountains.domain.model.FountainStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Data seeder for local development.
 * Runs when app.seeding.enabled=true (set by the 'local' profile) and adds
 * fountains on other continents beyond the Flyway seed, so world-level views
 * show more than one cluster.
 */
@Configuration
public class DataSeeder {

    private static final Logger logger = LoggerFactory.getLogger(DataSeeder.class);

    @Bean
    @ConditionalOnProperty(name = "app.seeding.enabled", havingValue = "true", matchIfMissing = false)
    public CommandLineRunner seedLocalData(FountainJpaRepository fountainRepository) {
        return args -> {
            if (fountainRepository.existsById("local_seed_paris")) {
                logger.info("Local seed data already exists, skipping...");
                return;
            }

            logger.info("Seeding local development data...");

            List<Fountain> fountains = List.of(
                    fountain("local_seed_paris", "Fontaine Wallace, Champ de Mars",
                            "48.85840000", "2.29450000", "potable", "public", "fountain"),
                    fountain("local_seed_notre_dame", "Fontaine Wallace, Parvis Notre-Dame",
                            "48.85300000", "2.34990000", "potable", "wheelchair", "fountain"),
                    fountain("local_seed_new_york", "Battery Park Drinking Fountain",
                            "40.71280000", "-74.00600000", "potable", "public", "tap"));

            Fountain removed = fountain("local_seed_removed", "Demolished Fountain",
                    "48.86000000", "2.33000000", "non-potable", "public", "fountain");
            removed.setStatus(FountainStatus.removed);

            fountainRepository.saveAll(fountains);
            fountainRepository.save(removed);

            logger.info("Local seeding complete: {} fountains", fountains.size() + 1);
        };
    }

    private static Fountain fountain(String id, String name, String lat, String lng,
                                     String waterQuality, String accessibility, String type) {
        Fountain fountain = new Fountain(id, name, new BigDecimal(lat), new BigDecimal(lng));
        fountain.setWaterQuality(waterQuality);
        fountain.setAccessibility(accessibility);
        fountain.setType(type);
        fountain.setOsmSource("local-seed");
        fountain.setTags(new HashSet<>(Set.of("amenity=drinking_water")));
        return fountain;
    }
}
