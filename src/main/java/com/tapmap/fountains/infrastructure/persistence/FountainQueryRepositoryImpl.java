package com.tapmap.fountains.infrastructure.persistence;

import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.ClusterRow;
import com.tapmap.fountains.domain.model.Fountain;
import com.tapmap.fountains.domain.model.FountainFilter;
import com.tapmap.fountains.domain.model.FountainStatus;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JPQL implementation of the viewport queries.
 *
 * The geohash precision is written into the query text rather than bound: the
 * prefix expression must be textually identical in SELECT and GROUP BY for
 * PostgreSQL to accept the grouping. It is an int checked by the caller.
 */
public class FountainQueryRepositoryImpl implements FountainQueryRepository {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<ClusterRow> aggregateByGeohashPrefix(BoundingBox box, int precision, FountainFilter filter) {
        if (precision < 1 || precision > Fountain.GEOHASH_PRECISION) {
            throw new IllegalArgumentException("Geohash precision out of range: " + precision);
        }
        FilterClause where = FilterClause.of(box, filter);
        if (where.matchesNothing()) {
            return List.of();
        }

        String prefix = "substring(f.geohash, 1, " + precision + ")";
        String jpql = "SELECT " + prefix + ", count(f), avg(f.latitude), avg(f.longitude)"
                + " FROM Fountain f"
                + " WHERE f.geohash IS NOT NULL AND " + where.jpql()
                + " GROUP BY " + prefix
                + " ORDER BY " + prefix;

        TypedQuery<Object[]> query = entityManager.createQuery(jpql, Object[].class);
        where.bind(query);

        return query.getResultList().stream()
                .map(row -> new ClusterRow(
                        (String) row[0],
                        ((Number) row[1]).longValue(),
                        ((Number) row[2]).doubleValue(),
                        ((Number) row[3]).doubleValue()))
                .toList();
    }

    @Override
    public List<Fountain> findInBounds(BoundingBox box, FountainFilter filter, int maxResults) {
        FilterClause where = FilterClause.of(box, filter);
        if (where.matchesNothing()) {
            return List.of();
        }
        TypedQuery<Fountain> query = pointQuery(where);
        query.setMaxResults(maxResults);
        return query.getResultList();
    }

    @Override
    public List<Fountain> findAllInBounds(BoundingBox box, FountainFilter filter) {
        FilterClause where = FilterClause.of(box, filter);
        if (where.matchesNothing()) {
            return List.of();
        }
        return pointQuery(where).getResultList();
    }

    private TypedQuery<Fountain> pointQuery(FilterClause where) {
        String jpql = "SELECT f FROM Fountain f"
                + " WHERE " + where.jpql()
                + " ORDER BY f.latitude ASC, f.longitude ASC, f.id ASC";

        TypedQuery<Fountain> query = entityManager.createQuery(jpql, Fountain.class);
        where.bind(query);
        return query;
    }

    /**
     * WHERE clause for a box and filter, with its named parameters.
     * Built once per query and shared by the aggregate and point paths.
     */
    static final class FilterClause {
        private final StringBuilder jpql = new StringBuilder();
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private boolean matchesNothing;

        static FilterClause of(BoundingBox box, FountainFilter filter) {
            FilterClause clause = new FilterClause();
            clause.append("f.latitude BETWEEN :minLat AND :maxLat");
            clause.append("f.longitude BETWEEN :minLng AND :maxLng");
            clause.parameters.put("minLat", BigDecimal.valueOf(box.getMinLat()));
            clause.parameters.put("maxLat", BigDecimal.valueOf(box.getMaxLat()));
            clause.parameters.put("minLng", BigDecimal.valueOf(box.getMinLng()));
            clause.parameters.put("maxLng", BigDecimal.valueOf(box.getMaxLng()));

            Set<FountainStatus> statuses = filter.allowedStatuses();
            if (statuses.isEmpty()) {
                clause.matchesNothing = true;
            }
            clause.append("f.status IN :statuses");
            clause.parameters.put("statuses", statuses);

            clause.appendIn("f.waterQuality", "waterQualities", filter.getWaterQualities());
            clause.appendIn("f.accessibility", "accessibilities", filter.getAccessibilities());
            clause.appendIn("f.type", "types", filter.getTypes());
            return clause;
        }

        String jpql() {
            return jpql.toString();
        }

        boolean matchesNothing() {
            return matchesNothing;
        }

        void bind(TypedQuery<?> query) {
            parameters.forEach(query::setParameter);
        }

        private void appendIn(String path, String name, Set<String> allowList) {
            if (allowList.isEmpty()) {
                return;
            }
            append(path + " IN :" + name);
            parameters.put(name, allowList);
        }

        private void append(String condition) {
            if (jpql.length() > 0) {
                jpql.append(" AND ");
            }
            jpql.append(condition);
        }
    }
}
