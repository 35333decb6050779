package com.tapmap.fountains.application.mapper;

import com.tapmap.fountains.api.dto.ClusterRowDto;
import com.tapmap.fountains.api.dto.FountainDetailsDto;
import com.tapmap.fountains.api.dto.FountainResponseDto;
import com.tapmap.fountains.api.dto.NearbyFountainDto;
import com.tapmap.fountains.domain.model.ClusterRow;
import com.tapmap.fountains.domain.model.Fountain;
import com.tapmap.fountains.domain.model.NearbyFountain;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper for converting between domain models and DTOs.
 */
@Component
public class FountainMapper {

  public FountainResponseDto toDto(Fountain fountain) {
    return new FountainResponseDto(
        fountain.getId(),
        fountain.getName(),
        fountain.getLatitude(),
        fountain.getLongitude(),
        fountain.getGeohash(),
        fountain.getStatus() != null ? fountain.getStatus().name() : null,
        fountain.getWaterQuality(),
        fountain.getAccessibility());
  }

  /**
   * Maps a fountain with its tags; tags come back sorted so responses are stable.
   * Must run inside the transaction that loaded the fountain.
   */
  public FountainDetailsDto toDetailsDto(Fountain fountain) {
    List<String> tags = fountain.getTags() == null
        ? List.of()
        : fountain.getTags().stream().sorted().toList();
    return new FountainDetailsDto(
        fountain.getId(),
        fountain.getName(),
        fountain.getDescription(),
        fountain.getLatitude(),
        fountain.getLongitude(),
        fountain.getGeohash(),
        fountain.getType(),
        fountain.getStatus() != null ? fountain.getStatus().name() : null,
        fountain.getWaterQuality(),
        fountain.getAccessibility(),
        fountain.getAddedBy(),
        fountain.getAddedDate(),
        tags,
        fountain.getOsmId(),
        fountain.getOsmSource());
  }

  public NearbyFountainDto toDto(NearbyFountain nearby) {
    Fountain fountain = nearby.getFountain();
    return new NearbyFountainDto(
        fountain.getId(),
        fountain.getName(),
        fountain.getLatitude(),
        fountain.getLongitude(),
        fountain.getGeohash(),
        nearby.getDistanceKm(),
        fountain.getStatus() != null ? fountain.getStatus().name() : null,
        fountain.getWaterQuality(),
        fountain.getAccessibility());
  }

  public ClusterRowDto toDto(ClusterRow row) {
    return new ClusterRowDto(row.getGeohashPrefix(), row.getCount(), row.getCenterLat(), row.getCenterLng());
  }
}
