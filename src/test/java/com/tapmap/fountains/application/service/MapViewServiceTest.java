package com.tapmap.fountains.application.service;

import com.tapmap.fountains.api.dto.AggregatedResponseDto;
import com.tapmap.fountains.api.dto.ClusterRowDto;
import com.tapmap.fountains.api.dto.FountainResponseDto;
import com.tapmap.fountains.api.dto.MapViewResponseDto;
import com.tapmap.fountains.api.dto.PointwiseResponseDto;
import com.tapmap.fountains.application.dto.ViewportQuery;
import com.tapmap.fountains.application.mapper.FountainMapper;
import com.tapmap.fountains.application.port.out.FountainStore;
import com.tapmap.fountains.domain.model.FountainFilter;
import com.tapmap.fountains.domain.model.FountainStatus;
import com.tapmap.fountains.domain.model.ViewMode;
import com.tapmap.fountains.domain.policy.ViewportClassifier;
import com.tapmap.fountains.module.test.support.InMemoryFountainStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.util.List;

import static com.tapmap.fountains.module.test.support.TestFixtures.Boxes;
import static com.tapmap.fountains.module.test.support.TestFixtures.Coordinates;
import static com.tapmap.fountains.module.test.support.TestFixtures.fountain;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MapViewServiceTest {

    private InMemoryFountainStore store;
    private MapViewService mapViewService;

    @BeforeEach
    void setUp() {
        store = new InMemoryFountainStore()
                .add(fountain("civic", Coordinates.CIVIC_CENTER_LAT, Coordinates.CIVIC_CENTER_LNG,
                        FountainStatus.active, "potable", "wheelchair"))
                .add(fountain("soma", Coordinates.SOMA_LAT, Coordinates.SOMA_LNG,
                        FountainStatus.active, "non-potable", "public"))
                .add(fountain("soma-closed", "37.779", "-122.412",
                        FountainStatus.inactive, "potable", "public"))
                .add(fountain("paris", Coordinates.EIFFEL_TOWER_LAT, Coordinates.EIFFEL_TOWER_LNG));
        mapViewService = new MapViewService(
                new ViewportClassifier(),
                new ClusterAggregator(store),
                new PointRetriever(store),
                new FountainMapper(),
                new ConcurrentMapCacheManager(MapViewService.CLUSTER_CACHE),
                1000, 5000, 5000);
    }

    @Test
    void queryMapView_WorldView_ReturnsClustersAtPrecisionTwo() {
        MapViewResponseDto response = mapViewService.queryMapView(
                new ViewportQuery(Boxes.WORLD, null, null, null));

        assertThat(response).isInstanceOf(AggregatedResponseDto.class);
        AggregatedResponseDto aggregated = (AggregatedResponseDto) response;
        assertThat(aggregated.getPrecision()).isEqualTo(2);
        assertThat(aggregated.getRows()).extracting(ClusterRowDto::getGeohashPrefix).containsExactly("9q", "u0");
        assertThat(aggregated.getRows()).extracting(ClusterRowDto::getCount).containsExactly(2L, 1L);
    }

    @Test
    void queryMapView_SmallView_ReturnsPointsEvenWhenAggregateRequested() {
        MapViewResponseDto response = mapViewService.queryMapView(
                new ViewportQuery(Boxes.SOMA_BLOCKS, ViewMode.AGGREGATE, null, null));

        assertThat(response).isInstanceOf(PointwiseResponseDto.class);
        PointwiseResponseDto pointwise = (PointwiseResponseDto) response;
        assertThat(pointwise.getRows()).extracting(FountainResponseDto::getId).containsExactly("civic", "soma");
        assertThat(pointwise.isTruncated()).isFalse();
    }

    @Test
    void queryMapView_FilterAppliesInPointMode() {
        FountainFilter potableOnly = FountainFilter.of(null, List.of("potable"), null, null);

        PointwiseResponseDto response = (PointwiseResponseDto) mapViewService.queryMapView(
                new ViewportQuery(Boxes.SOMA_BLOCKS, null, potableOnly, null));

        assertThat(response.getRows()).extracting(FountainResponseDto::getId).containsExactly("civic");
    }

    @Test
    void queryMapView_LimitReportsTruncation() {
        PointwiseResponseDto response = (PointwiseResponseDto) mapViewService.queryMapView(
                new ViewportQuery(Boxes.SOMA_BLOCKS, ViewMode.POINTS, null, 1));

        assertThat(response.getRows()).hasSize(1);
        assertThat(response.isTruncated()).isTrue();
    }

    @Test
    void queryCounts_RepeatedQuery_IsServedFromCache() {
        AggregatedResponseDto first = mapViewService.queryCounts(Boxes.SAN_FRANCISCO_BAY, 5, FountainFilter.defaults());
        int callsAfterFirst = store.calls();

        AggregatedResponseDto second = mapViewService.queryCounts(Boxes.SAN_FRANCISCO_BAY, 5, FountainFilter.defaults());

        assertThat(store.calls()).isEqualTo(callsAfterFirst);
        assertThat(second.getRows()).usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(first.getRows());
    }

    @Test
    void queryCounts_DifferentFilter_IsNotServedFromOtherFiltersCacheEntry() {
        mapViewService.queryCounts(Boxes.SAN_FRANCISCO_BAY, 5, FountainFilter.defaults());

        AggregatedResponseDto inactive = mapViewService.queryCounts(Boxes.SAN_FRANCISCO_BAY, 5,
                FountainFilter.of(List.of("inactive"), null, null, null));

        assertThat(inactive.getRows()).extracting(ClusterRowDto::getCount).containsExactly(1L);
    }

    @Test
    void queryBounds_AppliesDefaultActiveFilter() {
        PointwiseResponseDto response = mapViewService.queryBounds(Boxes.SOMA_BLOCKS, null);

        assertThat(response.getRows()).extracting(FountainResponseDto::getStatus).containsOnly("active");
    }

    @Test
    void queryMapView_StoreFailure_PropagatesInsteadOfEmptyResult() {
        store.failWith(new FountainStore.StoreUnavailableException("connection refused", null));

        assertThatThrownBy(() -> mapViewService.queryMapView(new ViewportQuery(Boxes.SOMA_BLOCKS, null, null, null)))
                .isInstanceOf(FountainStore.StoreUnavailableException.class);
        assertThatThrownBy(() -> mapViewService.queryMapView(new ViewportQuery(Boxes.WORLD, null, null, null)))
                .isInstanceOf(FountainStore.StoreUnavailableException.class);
    }

    @Test
    void resolveLimit_DefaultsAndClampsToMaximum() {
        assertThat(mapViewService.resolveLimit(null, 1000)).isEqualTo(1000);
        assertThat(mapViewService.resolveLimit(250, 1000)).isEqualTo(250);
        assertThat(mapViewService.resolveLimit(9000, 1000)).isEqualTo(5000);
        assertThatThrownBy(() -> mapViewService.resolveLimit(0, 1000))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
