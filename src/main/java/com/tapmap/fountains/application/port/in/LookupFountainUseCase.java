package com.tapmap.fountains.application.port.in;

import com.tapmap.fountains.api.dto.FountainDetailsDto;
import com.tapmap.fountains.api.dto.FountainResponseDto;
import com.tapmap.fountains.api.dto.NearbyFountainDto;

import java.util.List;

/**
 * Input port for single-fountain lookup, search and proximity queries.
 */
public interface LookupFountainUseCase {

  FountainDetailsDto findById(String id);

  List<FountainResponseDto> searchByName(String name, Integer limit);

  /**
   * Fountains with a tag containing the term; details carry the full tag set.
   */
  List<FountainDetailsDto> searchByTag(String tag, Integer limit);

  /**
   * Active fountains within the radius of a point, nearest first.
   */
  List<NearbyFountainDto> findNearby(double lat, double lng, Double radiusKm, Integer limit);

  List<FountainResponseDto> findByGeohashPrefix(String prefix, Integer limit);
}
