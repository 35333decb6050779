package com.tapmap.fountains.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Bounds plus the optional attribute allow-lists. An empty list is the same as no list.
 */
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class FilteredBoundsDto extends BoundsDto {

    @JsonProperty("statuses")
    private List<String> statuses;

    @JsonProperty("water_qualities")
    private List<String> waterQualities;

    @JsonProperty("accessibilities")
    private List<String> accessibilities;

    @JsonProperty("types")
    private List<String> types;
}
