package com.localdeals.ingestion.repository;

import com.localdeals.ingestion.entity.Deal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;

@Repository
public interface DealRepository extends JpaRepository<Deal, Long> {

    /**
     * Deals whose validity window contains the given date
     */
    @Query("SELECT COUNT(d) FROM Deal d WHERE d.startDate <= :day AND d.endDate > :day")
    long countActiveOn(@Param("day") LocalDate day);
}
