package com.purchasingpower.signalintel.repository;

import com.purchasingpower.signalintel.model.cache.IntelligenceQueryEntity;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for cached pipeline runs.
 */
@Repository
public interface IntelligenceQueryRepository extends JpaRepository<IntelligenceQueryEntity, Long> {

    /**
     * Unexpired runs for a cache key, newest first, with results and contacts loaded.
     */
    @EntityGraph(attributePaths = {"results", "results.contact"})
    List<IntelligenceQueryEntity> findByQueryHashAndExpiresAtAfterOrderByCreatedAtDesc(
            String queryHash, LocalDateTime now);

    List<IntelligenceQueryEntity> findByExpiresAtBefore(LocalDateTime now);
}
