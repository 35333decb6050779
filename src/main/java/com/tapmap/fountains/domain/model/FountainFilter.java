package com.tapmap.fountains.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Request-scoped attribute allow-lists applied to both aggregate and point queries.
 *
 * An empty or absent allow-list places no restriction on its attribute, except for
 * status: without an explicit status allow-list only active fountains match.
 * Values that name nothing (unknown statuses, unused qualities) simply never match.
 */
@Getter
@EqualsAndHashCode
@ToString
public class FountainFilter {

    private static final FountainFilter DEFAULT = new FountainFilter(null, null, null, null);

    private final Set<String> statuses;
    private final Set<String> waterQualities;
    private final Set<String> accessibilities;
    private final Set<String> types;

    private FountainFilter(
            Collection<String> statuses,
            Collection<String> waterQualities,
            Collection<String> accessibilities,
            Collection<String> types) {
        this.statuses = normalize(statuses);
        this.waterQualities = normalize(waterQualities);
        this.accessibilities = normalize(accessibilities);
        this.types = normalize(types);
    }

    public static FountainFilter of(
            Collection<String> statuses,
            Collection<String> waterQualities,
            Collection<String> accessibilities,
            Collection<String> types) {
        return new FountainFilter(statuses, waterQualities, accessibilities, types);
    }

    /**
     * Filter with no allow-lists: active fountains only.
     */
    public static FountainFilter defaults() {
        return DEFAULT;
    }

    public boolean hasStatusFilter() {
        return !statuses.isEmpty();
    }

    /**
     * Statuses a matching fountain may have. Unknown names are dropped, so an
     * allow-list made only of unknown names resolves to an empty set and matches nothing.
     */
    public Set<FountainStatus> allowedStatuses() {
        if (statuses.isEmpty()) {
            return EnumSet.of(FountainStatus.active);
        }
        Set<FountainStatus> allowed = EnumSet.noneOf(FountainStatus.class);
        for (String value : statuses) {
            FountainStatus.fromValue(value).ifPresent(allowed::add);
        }
        return allowed;
    }

    /**
     * Reference form of the predicate. The store applies the same rules as a query
     * clause; this in-memory form must agree with it row for row.
     */
    public boolean matches(Fountain fountain) {
        return fountain.getStatus() != null
                && allowedStatuses().contains(fountain.getStatus())
                && allows(waterQualities, fountain.getWaterQuality())
                && allows(accessibilities, fountain.getAccessibility())
                && allows(types, fountain.getType());
    }

    /**
     * Stable textual form, independent of the order values were supplied in.
     */
    public String cacheKey() {
        return "s=" + String.join(",", statuses)
                + ";q=" + String.join(",", waterQualities)
                + ";a=" + String.join(",", accessibilities)
                + ";t=" + String.join(",", types);
    }

    private static boolean allows(Set<String> allowList, String value) {
        return allowList.isEmpty() || (value != null && allowList.contains(value));
    }

    private static Set<String> normalize(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(values.stream()
                .filter(value -> value != null)
                .collect(Collectors.toCollection(() -> new TreeSet<String>())));
    }
}
