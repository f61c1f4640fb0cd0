package com.localdeals.ingestion.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

@Entity
@Table(name = "google_reviews")
@Getter
@Setter
@NoArgsConstructor
public class BusinessReview {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false)
    private Long businessId;

    @Column(name = "author_name")
    private String authorName;

    @Column(name = "rating")
    private Integer rating;

    @Column(name = "text", columnDefinition = "TEXT")
    private String text;

    @Column(name = "relative_time", length = 100)
    private String relativeTime;

    @Column(name = "created_at", insertable = false, updatable = false)
    private OffsetDateTime createdAt;
}
