package com.purchasingpower.signalintel.service.cache;

import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.configuration.CacheProperties;
import com.purchasingpower.signalintel.core.Candidate;
import com.purchasingpower.signalintel.core.EnrichedContact;
import com.purchasingpower.signalintel.core.IntelligenceResult;
import com.purchasingpower.signalintel.core.Seniority;
import com.purchasingpower.signalintel.core.SignalType;
import com.purchasingpower.signalintel.core.SourceType;
import com.purchasingpower.signalintel.model.cache.IntelligenceContactEntity;
import com.purchasingpower.signalintel.model.cache.IntelligenceQueryEntity;
import com.purchasingpower.signalintel.model.cache.IntelligenceResultEntity;
import com.purchasingpower.signalintel.repository.IntelligenceQueryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * {@link ResultCache} backed by the intelligence_* tables.
 */
@Slf4j
@Service
public class JpaResultCache implements ResultCache {

    private final IntelligenceQueryRepository repository;
    private final CacheProperties config;
    private final Clock clock;

    public JpaResultCache(IntelligenceQueryRepository repository, AppProperties props, Clock clock) {
        this.repository = repository;
        this.config = props.getCache();
        this.clock = clock;
    }

    @Override
    public Optional<List<IntelligenceResult>> lookup(String query, String excludedDomain, boolean includeContacts) {
        if (!config.isEnabled()) {
            return Optional.empty();
        }
        String key = CacheKeys.of(query, excludedDomain);
        try {
            List<IntelligenceQueryEntity> entries =
                    repository.findByQueryHashAndExpiresAtAfterOrderByCreatedAtDesc(key, LocalDateTime.now(clock));
            if (entries.isEmpty() || entries.get(0).getResults().isEmpty()) {
                return Optional.empty();
            }

            List<IntelligenceResult> results = entries.get(0).getResults().stream()
                    .map(JpaResultCache::toResult)
                    .toList();
            boolean hasContacts = results.stream().anyMatch(r -> r.getContact() != null);
            if (includeContacts && !hasContacts) {
                log.info("💾 Cache entry for key {} has no contacts, recomputing", key.substring(0, 12));
                return Optional.empty();
            }

            log.info("💾 Cache hit for key {} ({} results)", key.substring(0, 12), results.size());
            return Optional.of(results);

        } catch (RuntimeException e) {
            log.warn("⚠️ Cache read failed, treating as miss: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void store(CachedRun run) {
        if (!config.isEnabled() || run.getResults().isEmpty()) {
            return;
        }
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            IntelligenceQueryEntity entity = new IntelligenceQueryEntity();
            entity.setQueryHash(CacheKeys.of(run.getQuery(), run.getExcludedDomain()));
            entity.setQueryText(run.getQuery());
            entity.setExcludedDomain(run.getExcludedDomain());
            entity.setResultCount(run.getResults().size());
            entity.setSearchRequestId(run.getSearchRequestId());
            entity.setCostSearch(run.getSearchCost());
            entity.setCostModel(run.getModelCost());
            entity.setCostEnrichment(run.getEnrichmentCost());
            entity.setLatencyMs(run.getLatencyMs());
            entity.setCreatedAt(now);
            entity.setExpiresAt(now.plus(config.getTtl()));

            int rank = 1;
            for (IntelligenceResult result : run.getResults()) {
                entity.addResult(toEntity(result, rank++));
            }

            repository.save(entity);
            log.info("💾 Cached {} results, expires {}", run.getResults().size(), entity.getExpiresAt());

        } catch (RuntimeException e) {
            log.warn("⚠️ Cache write failed, response unaffected: {}", e.getMessage());
        }
    }

    @Override
    @Transactional
    public int purgeExpired() {
        List<IntelligenceQueryEntity> expired = repository.findByExpiresAtBefore(LocalDateTime.now(clock));
        repository.deleteAll(expired);
        return expired.size();
    }

    // ================================================================
    // MAPPING
    // ================================================================

    private static IntelligenceResultEntity toEntity(IntelligenceResult result, int rank) {
        Candidate company = result.getCompany();
        IntelligenceResultEntity entity = new IntelligenceResultEntity();
        entity.setResultRank(rank);
        entity.setCompanyName(company.getCompanyName());
        entity.setCompanyDomain(company.getCompanyDomain());
        entity.setSignalType(company.getSignalType() != null ? company.getSignalType().getWireValue() : null);
        entity.setSignalTitle(company.getSignalHeadline());
        entity.setSignalDate(company.getSignalDate());
        entity.setSourceUrl(company.getSourceUrl());
        entity.setSourceType(company.getSourceType() != null ? company.getSourceType().getWireValue() : null);
        entity.setSourceTitle(company.getSourceTitle());
        entity.setMatchScore(company.getMatchScore());
        entity.setConfidence(company.getConfidence());
        entity.setOpportunityScore(company.getOpportunityScore());
        entity.setOpportunityReason(company.getOpportunityReason());

        EnrichedContact contact = result.getContact();
        if (contact != null) {
            IntelligenceContactEntity contactEntity = new IntelligenceContactEntity();
            contactEntity.setFullName(contact.getFullName());
            contactEntity.setFirstName(contact.getFirstName());
            contactEntity.setTitle(contact.getTitle());
            contactEntity.setEmail(contact.getEmail());
            contactEntity.setLinkedinUrl(contact.getProfileUrl());
            contactEntity.setSeniorityLevel(contact.getSeniority().getWireValue());
            contactEntity.setEnrichmentSource(contact.getSource());
            contactEntity.setEnrichmentStatus(contact.hasEmail()
                    ? IntelligenceContactEntity.STATUS_FOUND
                    : IntelligenceContactEntity.STATUS_NOT_FOUND);
            entity.attachContact(contactEntity);
        }
        return entity;
    }

    private static IntelligenceResult toResult(IntelligenceResultEntity entity) {
        Candidate company = Candidate.builder()
                .companyName(entity.getCompanyName())
                .companyDomain(entity.getCompanyDomain())
                .signalType(SignalType.parse(entity.getSignalType()))
                .signalHeadline(entity.getSignalTitle())
                .signalDate(entity.getSignalDate())
                .sourceUrl(entity.getSourceUrl())
                .sourceType(SourceType.parse(entity.getSourceType()))
                .sourceTitle(entity.getSourceTitle())
                .matchScore(entity.getMatchScore())
                .confidence(entity.getConfidence())
                .opportunityScore(entity.getOpportunityScore())
                .opportunityReason(entity.getOpportunityReason())
                .build();

        IntelligenceContactEntity contact = entity.getContact();
        if (contact == null) {
            return IntelligenceResult.withoutContact(company);
        }
        return new IntelligenceResult(company, EnrichedContact.builder()
                .fullName(contact.getFullName())
                .firstName(contact.getFirstName())
                .title(contact.getTitle())
                .email(contact.getEmail())
                .profileUrl(contact.getLinkedinUrl())
                .seniority(Seniority.parse(contact.getSeniorityLevel()))
                .source(contact.getEnrichmentSource())
                .build());
    }
}
