package com.purchasingpower.signalintel.service.fallback;

import com.purchasingpower.signalintel.core.Candidate;
import com.purchasingpower.signalintel.core.SearchHit;
import com.purchasingpower.signalintel.core.SignalType;
import com.purchasingpower.signalintel.core.SourceType;
import com.purchasingpower.signalintel.service.extraction.OpportunityScorer;
import com.purchasingpower.signalintel.util.DomainUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds candidates straight from hit URLs and titles, for use when model extraction
 * under-produces. The company is assumed to own the page's domain.
 */
@Component
public class TitleCandidateDeriver {

    static final double DERIVED_CONFIDENCE = 0.6;
    static final int MAX_HEADLINE_LENGTH = 100;

    /**
     * One unscored candidate per usable domain, in hit order.
     */
    public List<Candidate> derive(List<SearchHit> hits, String excludedDomain) {
        List<Candidate> derived = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (SearchHit hit : hits) {
            String domain = DomainUtils.extractDomain(hit.getUrl());
            if (domain == null
                    || DomainUtils.isNewsDomain(domain)
                    || DomainUtils.isSocialPlatform(domain)
                    || DomainUtils.matchesExcludedDomain(domain, excludedDomain)) {
                continue;
            }
            String name = DomainUtils.companyNameFromDomain(domain);
            if (name.isEmpty() || DomainUtils.isMediaCompanyName(name) || !seen.add(domain)) {
                continue;
            }

            derived.add(Candidate.builder()
                    .companyName(name)
                    .companyDomain(domain)
                    .signalType(SignalType.OTHER)
                    .signalHeadline(headline(hit.getTitle()))
                    .signalDate(hit.getPublishedAt() != null ? hit.getPublishedAt().toLocalDate() : null)
                    .sourceUrl(hit.getUrl())
                    .sourceType(SourceType.NEWS)
                    .sourceTitle(hit.getTitle())
                    .matchScore((int) Math.round(hit.getRelevanceScore() * 100))
                    .confidence(DERIVED_CONFIDENCE)
                    .build());
        }
        return derived;
    }

    private static String headline(String title) {
        if (title == null || title.isBlank()) {
            return OpportunityScorer.PLACEHOLDER_HEADLINE;
        }
        String trimmed = title.trim();
        return trimmed.length() > MAX_HEADLINE_LENGTH ? trimmed.substring(0, MAX_HEADLINE_LENGTH) : trimmed;
    }
}
