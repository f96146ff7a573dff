package com.purchasingpower.signalintel.model.cache;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

/**
 * A ranked company row of a cached run. Maps to the intelligence_results table.
 */
@Entity
@Table(name = "intelligence_results")
@Getter
@Setter
@NoArgsConstructor
public class IntelligenceResultEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "intel_result_seq")
    @SequenceGenerator(name = "intel_result_seq", sequenceName = "intel_result_seq", allocationSize = 1)
    @Column(name = "id")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "query_id", nullable = false)
    private IntelligenceQueryEntity query;

    /**
     * 1-based position in the ranked output.
     */
    @Column(name = "result_rank", nullable = false)
    private int resultRank;

    // ================================================================
    // COMPANY & SIGNAL
    // ================================================================

    @Column(name = "company_name", nullable = false, length = 500)
    private String companyName;

    @Column(name = "company_domain", length = 255)
    private String companyDomain;

    @Column(name = "signal_type", length = 50)
    private String signalType;

    @Column(name = "signal_title", length = 1000)
    private String signalTitle;

    @Column(name = "signal_date")
    private LocalDate signalDate;

    @Column(name = "source_url", length = 2000)
    private String sourceUrl;

    @Column(name = "source_type", length = 50)
    private String sourceType;

    @Column(name = "source_title", length = 1000)
    private String sourceTitle;

    // ================================================================
    // SCORES
    // ================================================================

    @Column(name = "match_score")
    private int matchScore;

    @Column(name = "confidence")
    private double confidence;

    @Column(name = "opportunity_score")
    private int opportunityScore;

    @Column(name = "opportunity_reason", length = 255)
    private String opportunityReason;

    @OneToOne(mappedBy = "result", cascade = CascadeType.ALL, orphanRemoval = true)
    private IntelligenceContactEntity contact;

    public void attachContact(IntelligenceContactEntity contact) {
        contact.setResult(this);
        this.contact = contact;
    }
}
