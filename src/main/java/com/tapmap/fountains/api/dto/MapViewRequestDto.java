package com.tapmap.fountains.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * DTO for the zoom-adaptive map-view request body.
 */
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class MapViewRequestDto extends FilteredBoundsDto {

    @JsonProperty("mode")
    @Pattern(regexp = "(?i)aggregate|points", message = "mode must be 'aggregate' or 'points'")
    private String mode;

    @JsonProperty("limit")
    @Min(value = 1, message = "limit must be at least 1")
    private Integer limit;
}
