package com.localdeals.ingestion.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

@Entity
@Table(name = "business_extras")
@Getter
@Setter
@NoArgsConstructor
public class BusinessExtras {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "business_id", nullable = false, unique = true)
    private Long businessId;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "menu_links", columnDefinition = "TEXT[]")
    private String[] menuLinks;

    @Column(name = "updated_at", insertable = false, updatable = false)
    private OffsetDateTime updatedAt;
}
