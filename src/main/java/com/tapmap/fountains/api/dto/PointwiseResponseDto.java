package com.tapmap.fountains.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@JsonTypeName("pointwise")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PointwiseResponseDto extends MapViewResponseDto {

    @JsonProperty("rows")
    private List<FountainResponseDto> rows;

    @JsonProperty("truncated")
    private boolean truncated;
}
