package com.tapmap.fountains.application.port.out;

import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.ClusterRow;
import com.tapmap.fountains.domain.model.Fountain;
import com.tapmap.fountains.domain.model.FountainFilter;

import java.util.List;
import java.util.Optional;

/**
 * Output port for read access to the fountain store.
 * Each call sees one consistent snapshot; nothing is shared between calls.
 */
public interface FountainStore {

  /**
   * Group fountains with a geohash inside the box by the first {@code precision}
   * geohash characters. Fountains without a geohash are not counted.
   */
  List<ClusterRow> aggregateByGeohashPrefix(BoundingBox box, int precision, FountainFilter filter);

  /**
   * Fountains inside the box (bounds inclusive) ordered by latitude, then longitude.
   */
  List<Fountain> findInBounds(BoundingBox box, FountainFilter filter, int maxResults);

  /**
   * Every fountain inside the box that passes the filter, in the same order as
   * {@link #findInBounds}. Callers keep the box small; there is no cap.
   */
  List<Fountain> findAllInBounds(BoundingBox box, FountainFilter filter);

  Optional<Fountain> findById(String id);

  /**
   * Active fountains whose name contains the term, ignoring case, ordered by name.
   */
  List<Fountain> searchActiveByName(String term, int maxResults);

  /**
   * Active fountains whose geohash starts with the prefix, ordered by name.
   */
  List<Fountain> findActiveByGeohashPrefix(String prefix, int maxResults);

  /**
   * Active fountains with at least one tag containing the term, ignoring case,
   * ordered by name. Each fountain appears once.
   */
  List<Fountain> searchActiveByTag(String term, int maxResults);

  /**
   * Cheap round trip used by the health check.
   */
  long countActive();

  /**
   * Thrown when the store cannot be reached or does not answer in time.
   * Callers must not read it as "nothing matched".
   */
  class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
