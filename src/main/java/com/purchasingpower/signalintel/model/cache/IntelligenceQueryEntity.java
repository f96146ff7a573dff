package com.purchasingpower.signalintel.model.cache;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One cached pipeline run. Maps to the intelligence_queries table.
 * Written once after a successful non-empty run; removed only by the expiry purge.
 */
@Entity
@Table(name = "intelligence_queries", indexes = {
        @Index(name = "idx_intel_queries_hash", columnList = "query_hash"),
        @Index(name = "idx_intel_queries_expires", columnList = "expires_at")
})
@Getter
@Setter
@NoArgsConstructor
public class IntelligenceQueryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "intel_query_seq")
    @SequenceGenerator(name = "intel_query_seq", sequenceName = "intel_query_seq", allocationSize = 1)
    @Column(name = "id")
    private Long id;

    // ================================================================
    // KEY
    // ================================================================

    @Column(name = "query_hash", nullable = false, length = 64)
    private String queryHash;

    @Column(name = "query_text", nullable = false, length = 2000)
    private String queryText;

    @Column(name = "excluded_domain", length = 255)
    private String excludedDomain;

    // ================================================================
    // RUN STATISTICS
    // ================================================================

    @Column(name = "result_count", nullable = false)
    private int resultCount;

    @Column(name = "search_request_id", length = 255)
    private String searchRequestId;

    @Column(name = "cost_search")
    private double costSearch;

    @Column(name = "cost_model")
    private double costModel;

    @Column(name = "cost_enrichment")
    private double costEnrichment;

    @Column(name = "latency_ms")
    private long latencyMs;

    // ================================================================
    // LIFECYCLE
    // ================================================================

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @OneToMany(mappedBy = "query", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("resultRank ASC")
    private List<IntelligenceResultEntity> results = new ArrayList<>();

    public void addResult(IntelligenceResultEntity result) {
        result.setQuery(this);
        results.add(result);
    }
}
