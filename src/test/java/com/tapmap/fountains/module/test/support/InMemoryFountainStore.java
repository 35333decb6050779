package com.tapmap.fountains.module.test.support;

import com.tapmap.fountains.application.port.out.FountainStore;
import com.tapmap.fountains.domain.model.BoundingBox;
import com.tapmap.fountains.domain.model.ClusterRow;
import com.tapmap.fountains.domain.model.Fountain;
import com.tapmap.fountains.domain.model.FountainFilter;
import com.tapmap.fountains.domain.model.FountainStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * FountainStore backed by a list, for service tests that should not need a database.
 * Filtering goes through {@link FountainFilter#matches(Fountain)}.
 * Can be switched to fail every call with {@link #failWith(RuntimeException)}.
 */
public class InMemoryFountainStore implements FountainStore {

    private final List<Fountain> fountains = new ArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private RuntimeException failure;

    public InMemoryFountainStore add(Fountain fountain) {
        fountains.add(fountain);
        return this;
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    /**
     * Number of store calls made so far.
     */
    public int calls() {
        return calls.get();
    }

    @Override
    public List<ClusterRow> aggregateByGeohashPrefix(BoundingBox box, int precision, FountainFilter filter) {
        enter();
        Map<String, List<Fountain>> groups = fountains.stream()
                .filter(f -> f.getGeohash() != null)
                .filter(f -> inBox(box, f) && filter.matches(f))
                .collect(Collectors.groupingBy(f -> f.getGeohash().substring(0, precision), TreeMap::new,
                        Collectors.toList()));

        List<ClusterRow> rows = new ArrayList<>();
        groups.forEach((prefix, members) -> rows.add(new ClusterRow(
                prefix,
                members.size(),
                members.stream().mapToDouble(f -> f.getLatitude().doubleValue()).average().orElse(0),
                members.stream().mapToDouble(f -> f.getLongitude().doubleValue()).average().orElse(0))));
        return rows;
    }

    @Override
    public List<Fountain> findInBounds(BoundingBox box, FountainFilter filter, int maxResults) {
        enter();
        return fountains.stream()
                .filter(f -> inBox(box, f) && filter.matches(f))
                .sorted(Comparator.comparing(Fountain::getLatitude)
                        .thenComparing(Fountain::getLongitude)
                        .thenComparing(Fountain::getId))
                .limit(maxResults)
                .toList();
    }

    @Override
    public List<Fountain> findAllInBounds(BoundingBox box, FountainFilter filter) {
        return findInBounds(box, filter, Integer.MAX_VALUE);
    }

    @Override
    public Optional<Fountain> findById(String id) {
        enter();
        return fountains.stream().filter(f -> f.getId().equals(id)).findFirst();
    }

    @Override
    public List<Fountain> searchActiveByName(String term, int maxResults) {
        enter();
        String needle = term.toLowerCase();
        return fountains.stream()
                .filter(f -> f.getStatus() == FountainStatus.active)
                .filter(f -> f.getName() != null && f.getName().toLowerCase().contains(needle))
                .sorted(Comparator.comparing(Fountain::getName))
                .limit(maxResults)
                .toList();
    }

    @Override
    public List<Fountain> findActiveByGeohashPrefix(String prefix, int maxResults) {
        enter();
        return fountains.stream()
                .filter(f -> f.getStatus() == FountainStatus.active)
                .filter(f -> f.getGeohash() != null && f.getGeohash().startsWith(prefix))
                .sorted(Comparator.comparing(Fountain::getName))
                .limit(maxResults)
                .toList();
    }

    @Override
    public List<Fountain> searchActiveByTag(String term, int maxResults) {
        enter();
        String needle = term.toLowerCase();
        return fountains.stream()
                .filter(f -> f.getStatus() == FountainStatus.active)
                .filter(f -> f.getTags().stream().anyMatch(tag -> tag.toLowerCase().contains(needle)))
                .sorted(Comparator.comparing(Fountain::getName))
                .limit(maxResults)
                .toList();
    }

    @Override
    public long countActive() {
        enter();
        return fountains.stream().filter(f -> f.getStatus() == FountainStatus.active).count();
    }

    private void enter() {
        calls.incrementAndGet();
        if (failure != null) {
            throw failure;
        }
    }

    private static boolean inBox(BoundingBox box, Fountain fountain) {
        return box.contains(fountain.getLatitude().doubleValue(), fountain.getLongitude().doubleValue());
    }
}
