package com.localdeals.ingestion.repository;

import com.localdeals.ingestion.entity.BusinessReview;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BusinessReviewRepository extends JpaRepository<BusinessReview, Long> {
}
