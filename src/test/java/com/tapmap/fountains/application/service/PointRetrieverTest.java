package com.tapmap.fountains.application.service;

import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.Fountain;
import com.tapmap.fountains.domain.model.FountainFilter;
import com.tapmap.fountains.domain.model.FountainStatus;
import com.tapmap.fountains.domain.model.PointPage;
import com.tapmap.fountains.module.test.support.InMemoryFountainStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tapmap.fountains.module.test.support.TestFixtures.fountain;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PointRetrieverTest {

    private static final BoundingBox BAY = new BoundingBox(37.0, 38.0, -123.0, -122.0);

    private InMemoryFountainStore store;
    private PointRetriever pointRetriever;

    @BeforeEach
    void setUp() {
        store = new InMemoryFountainStore()
                .add(fountain("north", "37.80", "-122.40"))
                .add(fountain("south", "37.70", "-122.40"))
                .add(fountain("middle-east", "37.75", "-122.30"))
                .add(fountain("middle-west", "37.75", "-122.50"))
                .add(fountain("closed", "37.72", "-122.40", FountainStatus.inactive, null, null))
                .add(fountain("paris", "48.8584", "2.2945"));
        pointRetriever = new PointRetriever(store);
    }

    @Test
    void retrieve_OrdersByLatitudeThenLongitude() {
        PointPage page = pointRetriever.retrieve(BAY, FountainFilter.defaults(), 10);

        assertThat(page.getPoints()).extracting(Fountain::getId)
                .containsExactly("south", "middle-west", "middle-east", "north");
        assertThat(page.isTruncated()).isFalse();
    }

    @Test
    void retrieve_MoreMatchesThanLimit_IsTruncated() {
        PointPage page = pointRetriever.retrieve(BAY, FountainFilter.defaults(), 2);

        assertThat(page.getPoints()).extracting(Fountain::getId).containsExactly("south", "middle-west");
        assertThat(page.isTruncated()).isTrue();
    }

    @Test
    void retrieve_ExactlyLimitMatches_IsNotTruncated() {
        PointPage page = pointRetriever.retrieve(BAY, FountainFilter.defaults(), 4);

        assertThat(page.getPoints()).hasSize(4);
        assertThat(page.isTruncated()).isFalse();
    }

    @Test
    void retrieve_MaximumIntLimit_ReturnsEverythingUntruncated() {
        PointPage page = pointRetriever.retrieve(BAY, FountainFilter.defaults(), Integer.MAX_VALUE);

        assertThat(page.getPoints()).hasSize(4);
        assertThat(page.isTruncated()).isFalse();
    }

    @Test
    void retrieve_StatusFilter_ReplacesActiveDefault() {
        FountainFilter inactiveOnly = FountainFilter.of(List.of("inactive"), null, null, null);

        PointPage page = pointRetriever.retrieve(BAY, inactiveOnly, 10);

        assertThat(page.getPoints()).extracting(Fountain::getId).containsExactly("closed");
    }

    @Test
    void retrieve_DegenerateBox_ReturnsEmptyWithoutStoreAccess() {
        PointPage page = pointRetriever.retrieve(new BoundingBox(38.0, 37.0, -123.0, -122.0),
                FountainFilter.defaults(), 10);

        assertThat(page.getPoints()).isEmpty();
        assertThat(page.isTruncated()).isFalse();
        assertThat(store.calls()).isZero();
    }

    @Test
    void retrieve_NonPositiveLimit_IsRejected() {
        assertThatThrownBy(() -> pointRetriever.retrieve(BAY, FountainFilter.defaults(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
