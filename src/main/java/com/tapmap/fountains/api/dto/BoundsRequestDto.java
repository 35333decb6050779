package com.tapmap.fountains.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class BoundsRequestDto extends BoundsDto {

    @JsonProperty("max_results")
    @Min(value = 1, message = "max_results must be at least 1")
    private Integer maxResults;
}
