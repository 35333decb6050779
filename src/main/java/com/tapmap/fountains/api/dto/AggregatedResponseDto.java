package com.tapmap.fountains.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@JsonTypeName("aggregated")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AggregatedResponseDto extends MapViewResponseDto {

    @JsonProperty("precision")
    private Integer precision;

    @JsonProperty("rows")
    private List<ClusterRowDto> rows;
}
