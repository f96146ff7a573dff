package com.purchasingpower.signalintel.util;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Domain helpers shared by extraction, fallback and enrichment.
 *
 * <p>The company domain of a candidate is always computed here from the search hit URL.
 * Nothing in this class ever looks at a domain proposed by a language model.
 *
 * @since 1.0.0
 */
public final class DomainUtils {

    private static final Pattern COMMON_SUBDOMAIN = Pattern.compile("^(www\\.|blog\\.|news\\.|careers\\.)");

    private static final Pattern SOCIAL_PLATFORM = Pattern.compile("^(linkedin|twitter|facebook|youtube|medium|substack|github)\\.");

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]");

    /**
     * Publication base names, matched by substring against the first domain label.
     */
    private static final List<String> NEWS_DOMAIN_BASES = List.of(
            "techcrunch", "forbes", "bloomberg", "medium", "reuters", "cnbc",
            "wsj", "nytimes", "bbc", "theverge", "wired", "venturebeat",
            "crunchbase", "businessinsider", "economist", "entrepreneur",
            "prnewswire", "businesswire", "globenewswire", "yahoo", "google",
            "substack", "github", "reddit", "twitter", "fiercepharma",
            "fiercebiotech", "statnews", "biopharmadive", "endpts", "evaluate",
            "indeed", "glassdoor", "lever", "greenhouse", "seekingalpha",
            "marketwatch", "investopedia", "benzinga", "barrons", "morningstar",
            "pitchbook", "dealogic", "axios", "politico", "thehill",
            "healthcaredive", "pharmadive", "biospace", "labiotech",
            "genengnews", "drugdiscoverytoday");

    /**
     * Short domains that would produce false positives under substring matching.
     */
    private static final Set<String> NEWS_DOMAINS_EXACT = Set.of("ft.com", "inc.com", "x.com");

    private static final Set<String> MEDIA_COMPANY_NAMES = Set.of(
            "reuters", "bloomberg", "forbes", "wsj", "wall street journal",
            "cnbc", "bbc", "nytimes", "new york times", "the verge", "wired",
            "techcrunch", "venturebeat", "business insider", "financial times",
            "the economist", "axios", "politico", "stat news", "statnews",
            "seeking alpha", "marketwatch", "barrons", "morningstar",
            "pitchbook", "crunchbase", "medium", "substack");

    private static final Set<String> TWO_LABEL_TLDS = Set.of("co.uk", "com.au", "co.nz", "co.jp");

    private static final int UNVERIFIABLE_LABEL_LENGTH = 3;
    private static final int NAME_PREFIX_LENGTH = 6;
    private static final int SIGNIFICANT_WORD_LENGTH = 3;
    private static final int MIN_REVERSE_MATCH_LENGTH = 4;

    private DomainUtils() {
    }

    /**
     * Hostname of {@code url}, lower-cased, with one common subdomain prefix removed.
     *
     * @return the domain, or {@code null} when the URL has no parseable host
     */
    public static String extractDomain(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String host = URI.create(url.trim()).getHost();
            if (host == null || host.isBlank()) {
                return null;
            }
            return COMMON_SUBDOMAIN.matcher(host.toLowerCase(Locale.ROOT)).replaceFirst("");
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public static boolean isNewsDomain(String domain) {
        if (domain == null || domain.isBlank()) {
            return false;
        }
        String d = domain.toLowerCase(Locale.ROOT).trim().replaceFirst("^www\\.", "");
        if (NEWS_DOMAINS_EXACT.contains(d)) {
            return true;
        }
        String base = firstLabel(d);
        return NEWS_DOMAIN_BASES.stream().anyMatch(nb ->
                base.contains(nb) || (base.length() >= MIN_REVERSE_MATCH_LENGTH && nb.contains(base)));
    }

    /**
     * True when the name is a publication brand, which means the model attributed a
     * signal to the outlet that reported it.
     */
    public static boolean isMediaCompanyName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        return MEDIA_COMPANY_NAMES.contains(name.toLowerCase(Locale.ROOT).trim());
    }

    public static boolean isSocialPlatform(String domain) {
        return domain != null && SOCIAL_PLATFORM.matcher(domain.toLowerCase(Locale.ROOT)).find();
    }

    /**
     * Plausibility check between a company name and the domain it was attributed to.
     * Fails open when the domain is missing or too short to verify.
     */
    public static boolean domainMatchesCompany(String domain, String companyName) {
        if (domain == null || domain.isBlank() || companyName == null || companyName.isBlank()) {
            return true;
        }
        String domainBase = firstLabel(domain.toLowerCase(Locale.ROOT));
        if (domainBase.length() <= UNVERIFIABLE_LABEL_LENGTH) {
            return true;
        }
        String lowerName = companyName.toLowerCase(Locale.ROOT);
        String nameClean = NON_ALPHANUMERIC.matcher(lowerName).replaceAll("");
        if (!nameClean.isEmpty() && nameClean.contains(domainBase)) {
            return true;
        }
        if (!nameClean.isEmpty()
                && domainBase.contains(nameClean.substring(0, Math.min(nameClean.length(), NAME_PREFIX_LENGTH)))) {
            return true;
        }
        return Arrays.stream(lowerName.split("\\s+"))
                .filter(word -> word.length() >= SIGNIFICANT_WORD_LENGTH)
                .map(word -> NON_ALPHANUMERIC.matcher(word).replaceAll(""))
                .filter(word -> !word.isEmpty())
                .anyMatch(domainBase::contains);
    }

    /**
     * Collapses a domain or URL to its registrable form ({@code blog.acme.com} to
     * {@code acme.com}, {@code shop.acme.co.uk} to {@code acme.co.uk}).
     */
    public static String toRegistrableDomain(String domain) {
        if (domain == null) {
            return null;
        }
        String normalized = domain.toLowerCase(Locale.ROOT).trim()
                .replaceFirst("^https?://", "")
                .replaceFirst("^www\\.", "")
                .replaceFirst("/+$", "");
        int slash = normalized.indexOf('/');
        if (slash >= 0) {
            normalized = normalized.substring(0, slash);
        }

        String[] parts = normalized.split("\\.");
        if (parts.length > 2) {
            String lastTwo = parts[parts.length - 2] + "." + parts[parts.length - 1];
            int keep = TWO_LABEL_TLDS.contains(lastTwo) ? 3 : 2;
            normalized = String.join(".", Arrays.copyOfRange(parts, parts.length - keep, parts.length));
        }
        return normalized;
    }

    /**
     * True when {@code domain} belongs to the caller's own prospect and must not be returned.
     */
    public static boolean matchesExcludedDomain(String domain, String excludedDomain) {
        if (domain == null || excludedDomain == null || excludedDomain.isBlank()) {
            return false;
        }
        String excluded = toRegistrableDomain(excludedDomain);
        if (excluded == null || excluded.isEmpty()) {
            return false;
        }
        String candidate = toRegistrableDomain(domain);
        return candidate.equals(excluded) || candidate.endsWith("." + excluded);
    }

    /**
     * "acme.com" becomes "Acme".
     */
    public static String companyNameFromDomain(String domain) {
        String label = firstLabel(domain == null ? "" : domain.toLowerCase(Locale.ROOT));
        if (label.isEmpty()) {
            return label;
        }
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }

    private static String firstLabel(String domain) {
        int dot = domain.indexOf('.');
        return dot < 0 ? domain : domain.substring(0, dot);
    }
}
