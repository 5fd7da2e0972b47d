package com.example.pms.router.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ExtractionAuditRepository extends JpaRepository<ExtractionAuditEntity, Long> {
}
