package com.tapmap.fountains.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundingBoxTest {

    @Test
    void constructor_RejectsOutOfRangeCoordinates() {
        assertThatThrownBy(() -> new BoundingBox(-91, 0, 0, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minLat");
        assertThatThrownBy(() -> new BoundingBox(0, 1, 0, 180.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxLng");
    }

    @Test
    void constructor_RejectsNonFiniteCoordinates() {
        assertThatThrownBy(() -> new BoundingBox(0, Double.NaN, 0, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("finite");
        assertThatThrownBy(() -> new BoundingBox(0, 1, Double.NEGATIVE_INFINITY, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isDegenerate_ZeroWidthOrInverted() {
        assertThat(new BoundingBox(0, 1, 0, 1).isDegenerate()).isFalse();
        assertThat(new BoundingBox(1, 1, 0, 1).isDegenerate()).isTrue();
        assertThat(new BoundingBox(0, 1, 2, 2).isDegenerate()).isTrue();
        assertThat(new BoundingBox(2, 1, 0, 1).isDegenerate()).isTrue();
        // Crossing the antimeridian reads as inverted
        assertThat(new BoundingBox(0, 1, 170, -170).isDegenerate()).isTrue();
    }

    @Test
    void contains_BoundsAreInclusive() {
        BoundingBox box = new BoundingBox(0, 1, 0, 1);

        assertThat(box.contains(0, 0)).isTrue();
        assertThat(box.contains(1, 1)).isTrue();
        assertThat(box.contains(0.5, 1.0001)).isFalse();
    }
}
