package com.tapmap.fountains.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FountainTest {

    @Test
    void constructor_ComputesGeohashAtStoredPrecision() {
        Fountain fountain = new Fountain("f1", "Civic Center", new BigDecimal("37.7749"), new BigDecimal("-122.4194"));

        assertThat(fountain.getGeohash()).isEqualTo("9q8yyk8ytp");
        assertThat(fountain.getGeohash()).hasSize(Fountain.GEOHASH_PRECISION);
        assertThat(fountain.getStatus()).isEqualTo(FountainStatus.active);
        assertThat(fountain.getType()).isEqualTo("fountain");
    }

    @Test
    void relocate_RecomputesGeohash() {
        Fountain fountain = new Fountain("f1", "Moved", new BigDecimal("37.7749"), new BigDecimal("-122.4194"));

        fountain.relocate(new BigDecimal("48.8584"), new BigDecimal("2.2945"));

        assertThat(fountain.getLatitude()).isEqualByComparingTo("48.8584");
        assertThat(fountain.getGeohash()).isEqualTo("u09tunquc9");
    }

    @Test
    void relocate_RejectsMissingCoordinates() {
        Fountain fountain = new Fountain("f1", "Test", BigDecimal.ONE, BigDecimal.ONE);

        assertThatThrownBy(() -> fountain.relocate(null, BigDecimal.ONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(fountain.getLatitude()).isEqualByComparingTo(BigDecimal.ONE);
    }
}
