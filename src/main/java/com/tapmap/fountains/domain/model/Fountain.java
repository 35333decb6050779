package com.tapmap.fountains.domain.model;

import com.tapmap.fountains.domain.policy.GeohashEncoder;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "fountains", indexes = {
        @Index(name = "idx_fountains_lat_lng", columnList = "latitude,longitude"),
        @Index(name = "idx_fountains_geohash", columnList = "geohash"),
        @Index(name = "idx_fountains_status", columnList = "status"),
        @Index(name = "idx_fountains_accessibility", columnList = "accessibility")
})
@Getter
@Setter
@NoArgsConstructor
public class Fountain {

    /**
     * Precision the stored geohash is computed at; any shorter prefix can be grouped on.
     */
    public static final int GEOHASH_PRECISION = 10;

    @Id
    @Column(name = "id", length = 255)
    private String id;

    @Column(name = "name", length = 500)
    private String name;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Setter(AccessLevel.NONE)
    @Column(name = "latitude", nullable = false, precision = 10, scale = 8)
    private BigDecimal latitude;

    @Setter(AccessLevel.NONE)
    @Column(name = "longitude", nullable = false, precision = 11, scale = 8)
    private BigDecimal longitude;

    @Setter(AccessLevel.NONE)
    @Column(name = "geohash", length = 12)
    private String geohash;

    @Column(name = "type", length = 50)
    private String type = "fountain";

    @Column(name = "status", length = 50)
    @Enumerated(EnumType.STRING)
    private FountainStatus status = FountainStatus.active;

    @Column(name = "water_quality", length = 50)
    private String waterQuality;

    @Column(name = "accessibility", length = 50)
    private String accessibility;

    @Column(name = "added_by", length = 255)
    private String addedBy;

    @Column(name = "added_date")
    private LocalDateTime addedDate;

    @Column(name = "osm_id", length = 255)
    private String osmId;

    @Column(name = "osm_source", length = 100)
    private String osmSource;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "fountain_tags", joinColumns = @JoinColumn(name = "fountain_id"))
    @Column(name = "tag", nullable = false)
    private Set<String> tags = new HashSet<>();

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    // Constructor for creating new fountains
    public Fountain(String id, String name, BigDecimal latitude, BigDecimal longitude) {
        this.id = id;
        this.name = name;
        relocate(latitude, longitude);
    }

    /**
     * Moves the fountain and recomputes its geohash so the two never disagree.
     */
    public void relocate(BigDecimal latitude, BigDecimal longitude) {
        if (latitude == null || longitude == null) {
            throw new IllegalArgumentException("Latitude and longitude must not be null");
        }
        this.latitude = latitude;
        this.longitude = longitude;
        this.geohash = GeohashEncoder.encode(latitude.doubleValue(), longitude.doubleValue(), GEOHASH_PRECISION);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = LocalDateTime.now();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
