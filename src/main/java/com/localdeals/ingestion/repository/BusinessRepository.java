package com.localdeals.ingestion.repository;

import com.localdeals.ingestion.entity.Business;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;

@Repository
public interface BusinessRepository extends JpaRepository<Business, Long> {

    /**
     * Businesses written at or after the given instant, i.e. touched by the current run
     */
    @Query("SELECT COUNT(b) FROM Business b WHERE b.updatedAt >= :since")
    long countUpdatedSince(@Param("since") OffsetDateTime since);
}
