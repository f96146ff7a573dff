package com.purchasingpower.signalintel.service.enrichment;

import com.purchasingpower.signalintel.client.ApolloClient;
import com.purchasingpower.signalintel.client.ApolloClient.PeopleQuery;
import com.purchasingpower.signalintel.client.ApolloPerson;
import com.purchasingpower.signalintel.config.ExecutorConfig;
import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.configuration.EnrichmentProperties;
import com.purchasingpower.signalintel.core.Candidate;
import com.purchasingpower.signalintel.core.Capability;
import com.purchasingpower.signalintel.core.EnrichedContact;
import com.purchasingpower.signalintel.core.IntelligenceResult;
import com.purchasingpower.signalintel.core.Seniority;
import com.purchasingpower.signalintel.exception.ProviderException;
import com.purchasingpower.signalintel.service.pipeline.PipelineContext;
import com.purchasingpower.signalintel.util.DomainUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * ContactEnrichmentService - resolves at most one decision-maker per company.
 *
 * Candidates are enriched concurrently; the lookups for one candidate run sequentially:
 * 1. each {@link TitleTier} by registrable domain, most senior first
 * 2. the top tiers again by company name when every domain search missed
 * 3. a detail fetch by person id to obtain the email
 *
 * Finding nobody is a normal outcome and yields a result without contact.
 */
@Slf4j
@Service
public class ContactEnrichmentService {

    private final ApolloClient apolloClient;
    private final Executor executor;
    private final EnrichmentProperties config;

    public ContactEnrichmentService(ApolloClient apolloClient,
                                    @Qualifier(ExecutorConfig.INTELLIGENCE_EXECUTOR) Executor executor,
                                    AppProperties props) {
        this.apolloClient = apolloClient;
        this.executor = executor;
        this.config = props.getEnrichment();
    }

    /**
     * Pairs every candidate with its contact, preserving candidate order.
     */
    public List<IntelligenceResult> enrichAll(List<Candidate> candidates, PipelineContext context,
                                              boolean includeContacts) {
        if (!includeContacts || !context.isEnabled(Capability.CONTACT_ENRICHMENT)) {
            if (includeContacts) {
                log.info("👤 Contact enrichment skipped: {}", context.statusOf(Capability.CONTACT_ENRICHMENT));
            }
            return candidates.stream().map(IntelligenceResult::withoutContact).toList();
        }

        List<CompletableFuture<IntelligenceResult>> futures = candidates.stream()
                .map(candidate -> CompletableFuture.supplyAsync(
                        () -> new IntelligenceResult(candidate, findContact(candidate, context)), executor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<IntelligenceResult> results = futures.stream().map(CompletableFuture::join).toList();
        long found = results.stream().filter(r -> r.getContact() != null).count();
        log.info("👤 Enrichment found contacts for {}/{} companies", found, results.size());
        return results;
    }

    /**
     * @return the contact, or {@code null} when none was found or enrichment is unavailable
     */
    public EnrichedContact findContact(Candidate candidate, PipelineContext context) {
        if (candidate.getCompanyDomain() == null || candidate.getCompanyDomain().isBlank()
                || !context.isEnabled(Capability.CONTACT_ENRICHMENT)) {
            return null;
        }
        context.getCosts().addEnrichment(config.getCostPerLookup());

        String domain = DomainUtils.toRegistrableDomain(candidate.getCompanyDomain());
        String apiKey = context.getCredentials().getEnrichmentApiKey();

        try {
            Optional<ApolloPerson> match = searchTiers(domain, null, Arrays.asList(TitleTier.values()), apiKey, context);

            if (match.isEmpty() && candidate.getCompanyName() != null && !candidate.getCompanyName().isBlank()) {
                List<TitleTier> nameTiers = Arrays.asList(TitleTier.values())
                        .subList(0, Math.min(config.getNameFallbackTiers(), TitleTier.values().length));
                log.debug("No contact by domain {}, trying company name \"{}\"", domain, candidate.getCompanyName());
                match = searchTiers(null, candidate.getCompanyName(), nameTiers, apiKey, context);
            }

            if (match.isEmpty()) {
                return null;
            }

            ApolloPerson found = match.get();
            return toContact(fetchDetail(found, apiKey, context), found);

        } catch (ProviderException e) {
            if (e.isRejected()) {
                context.markRejected(Capability.CONTACT_ENRICHMENT);
            }
            return null;
        } catch (RuntimeException e) {
            log.warn("⚠️ Enrichment failed for {}, continuing without contact: {}", domain, e.getMessage());
            return null;
        }
    }

    private Optional<ApolloPerson> searchTiers(String domain, String organizationName, List<TitleTier> tiers,
                                               String apiKey, PipelineContext context) {
        for (TitleTier tier : tiers) {
            if (!context.isEnabled(Capability.CONTACT_ENRICHMENT)) {
                return Optional.empty();
            }
            Optional<ApolloPerson> person = apolloClient.searchPeople(
                    new PeopleQuery(domain, organizationName, tier.getTitles(), tier.getSeniorities()), apiKey);
            if (person.isPresent() && person.get().hasId()) {
                log.debug("Contact found at tier {} for {}", tier, domain != null ? domain : organizationName);
                return person;
            }
        }
        return Optional.empty();
    }

    private ApolloPerson fetchDetail(ApolloPerson found, String apiKey, PipelineContext context) {
        try {
            return apolloClient.enrichPerson(found.id(), apiKey).orElse(found);
        } catch (ProviderException e) {
            if (e.isRejected()) {
                context.markRejected(Capability.CONTACT_ENRICHMENT);
            }
            log.debug("Detail fetch failed for person {}, keeping search payload", found.id());
            return found;
        } catch (RuntimeException e) {
            log.warn("⚠️ Detail fetch failed for person {}, keeping search payload: {}", found.id(), e.getMessage());
            return found;
        }
    }

    /**
     * Detail fields win; search fields fill the gaps.
     */
    static EnrichedContact toContact(ApolloPerson detailed, ApolloPerson searched) {
        String title = firstNonBlank(detailed.title(), searched.title());
        return EnrichedContact.builder()
                .fullName(firstNonBlank(detailed.displayName(), searched.displayName()))
                .firstName(firstNonBlank(detailed.firstName(), searched.firstName()))
                .title(title)
                .email(firstNonBlank(detailed.email(), searched.email()))
                .profileUrl(firstNonBlank(detailed.linkedinUrl(), searched.linkedinUrl()))
                .seniority(Seniority.fromTitle(title))
                .source(EnrichedContact.SOURCE_APOLLO)
                .build();
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
