package com.tapmap.fountains.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class CountsRequestDto extends FilteredBoundsDto {

    @JsonProperty("geohash_precision")
    @Min(value = 1, message = "geohash_precision must be between 1 and 10")
    @Max(value = 10, message = "geohash_precision must be between 1 and 10")
    private Integer geohashPrecision;
}
