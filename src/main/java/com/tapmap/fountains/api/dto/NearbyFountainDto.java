package com.tapmap.fountains.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class NearbyFountainDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("lat")
    private BigDecimal lat;

    @JsonProperty("lng")
    private BigDecimal lng;

    @JsonProperty("geohash")
    private String geohash;

    @JsonProperty("distance_km")
    private double distanceKm;

    @JsonProperty("status")
    private String status;

    @JsonProperty("water_quality")
    private String waterQuality;

    @JsonProperty("accessibility")
    private String accessibility;
}
