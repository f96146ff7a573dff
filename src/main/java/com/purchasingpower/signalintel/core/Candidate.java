package com.purchasingpower.signalintel.core;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Locale;

/**
 * A company plus the business signal it was found with.
 *
 * <p>{@code companyDomain} is always re-derived from {@code sourceUrl}; it is never taken from
 * model output. {@code opportunityScore} is mutable because the multi-signal bonus is applied
 * to a whole batch after individual scoring.
 *
 * @since 1.0.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Candidate {

    private String companyName;

    private String companyDomain;

    private SignalType signalType;

    @JsonAlias("signalTitle")
    private String signalHeadline;

    private LocalDate signalDate;

    private String sourceUrl;

    private SourceType sourceType;

    private String sourceTitle;

    private int matchScore;

    private double confidence;

    private int opportunityScore;

    private String opportunityReason;

    /**
     * Grouping key used by every dedup pass: the domain, or the name when no domain is known.
     */
    public String dedupKey() {
        String base = companyDomain != null && !companyDomain.isBlank() ? companyDomain : companyName;
        return base == null ? "" : base.toLowerCase(Locale.ROOT).trim();
    }
}
