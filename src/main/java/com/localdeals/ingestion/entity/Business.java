package com.localdeals.ingestion.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Read-side mapping of the {@code businesses} table. Writes go through
 * {@link com.localdeals.ingestion.repository.JdbcBusinessWriteRepository}.
 */
@Entity
@Table(name = "businesses")
@Getter
@Setter
@NoArgsConstructor
public class Business {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "google_place_id", nullable = false, unique = true)
    private String googlePlaceId;

    @Column(name = "yelp_id")
    private String yelpId;

    @Column(name = "name")
    private String name;

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "address", columnDefinition = "TEXT")
    private String address;

    @Column(name = "lat")
    private Double latitude;

    @Column(name = "lon")
    private Double longitude;

    @Column(name = "phone", length = 50)
    private String phone;

    @Column(name = "website", columnDefinition = "TEXT")
    private String website;

    @Column(name = "rating")
    private Double rating;

    @Column(name = "rating_count")
    private Integer ratingCount;

    @Column(name = "price_level")
    private Integer priceLevel;

    @Column(name = "opening_hours", columnDefinition = "JSONB", insertable = false, updatable = false)
    private String openingHours;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "photo_path", columnDefinition = "TEXT")
    private String photoPath;

    @Column(name = "maps_url", columnDefinition = "TEXT")
    private String mapsUrl;

    @Column(name = "created_at", insertable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", insertable = false, updatable = false)
    private OffsetDateTime updatedAt;

    @Override
    public String toString() {
        return String.format("Business{id=%d, googlePlaceId='%s', name='%s'}", id, googlePlaceId, name);
    }
}
