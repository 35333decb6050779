package com.tapmap.fountains.api.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Tagged union returned by the map-view endpoint; the {@code type} property tells
 * clients whether rows are clusters or fountains.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AggregatedResponseDto.class, name = "aggregated"),
        @JsonSubTypes.Type(value = PointwiseResponseDto.class, name = "pointwise")
})
public abstract class MapViewResponseDto {
}
