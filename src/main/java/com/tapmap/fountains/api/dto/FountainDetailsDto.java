package com.tapmap.fountains.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Full fountain record returned by the single-fountain lookup.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class FountainDetailsDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("lat")
    private BigDecimal lat;

    @JsonProperty("lng")
    private BigDecimal lng;

    @JsonProperty("geohash")
    private String geohash;

    @JsonProperty("type")
    private String type;

    @JsonProperty("status")
    private String status;

    @JsonProperty("water_quality")
    private String waterQuality;

    @JsonProperty("accessibility")
    private String accessibility;

    @JsonProperty("added_by")
    private String addedBy;

    @JsonProperty("added_date")
    private LocalDateTime addedDate;

    @JsonProperty("tags")
    private List<String> tags;

    @JsonProperty("osm_id")
    private String osmId;

    @JsonProperty("osm_source")
    private String osmSource;
}
