package com.localdeals.ingestion.repository;

import com.localdeals.ingestion.entity.BusinessExtras;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BusinessExtrasRepository extends JpaRepository<BusinessExtras, Long> {
}
