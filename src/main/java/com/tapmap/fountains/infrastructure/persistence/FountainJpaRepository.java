package com.tapmap.fountains.infrastructure.persistence;

import com.tapmap.fountains.domain.model.Fountain;
import com.tapmap.fountains.domain.model.FountainStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data repository for fountains; viewport queries live in the
 * {@link FountainQueryRepository} fragment.
 */
@Repository
public interface FountainJpaRepository extends JpaRepository<Fountain, String>, FountainQueryRepository {

    /**
     * Name search used by the search endpoint. The pageable only carries the limit.
     */
    List<Fountain> findByStatusAndNameContainingIgnoreCaseOrderByNameAsc(
            FountainStatus status,
            String name,
            Pageable pageable);

    /**
     * Geohash prefix lookup. Spring Data escapes LIKE wildcards in the prefix.
     */
    List<Fountain> findByStatusAndGeohashStartingWithOrderByNameAsc(
            FountainStatus status,
            String prefix,
            Pageable pageable);

    /**
     * Tag search. The term must already be lower case; locate keeps it free of LIKE wildcards.
     * Matching goes through a subquery so a fountain with several matching tags is returned once.
     */
    @Query("SELECT f FROM Fountain f"
            + " WHERE f.status = :status"
            + " AND f.id IN (SELECT g.id FROM Fountain g JOIN g.tags t WHERE locate(:term, lower(t)) > 0)"
            + " ORDER BY f.name ASC")
    List<Fountain> searchByStatusAndTag(
            @Param("status") FountainStatus status,
            @Param("term") String term,
            Pageable pageable);

    long countByStatus(FountainStatus status);
}
