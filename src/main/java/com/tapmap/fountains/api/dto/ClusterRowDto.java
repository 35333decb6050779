package com.tapmap.fountains.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ClusterRowDto {

    @JsonProperty("geohash_prefix")
    private String geohashPrefix;

    @JsonProperty("count")
    private Long count;

    @JsonProperty("center_lat")
    private Double centerLat;

    @JsonProperty("center_lng")
    private Double centerLng;
}
