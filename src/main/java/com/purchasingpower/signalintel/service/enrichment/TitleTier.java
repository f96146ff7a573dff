package com.purchasingpower.signalintel.service.enrichment;

import java.util.List;

/**
 * Decision-maker brackets searched in order; the first tier with a match wins.
 */
public enum TitleTier {
    EXECUTIVE(
            List.of("CEO", "Founder", "Co-Founder", "Managing Partner", "Partner", "President", "Owner"),
            List.of("c_suite", "founder", "owner")),
    INVESTMENT_LEADERSHIP(
            List.of("Chief Investment Officer", "CIO", "Principal", "Investment Director", "Managing Director"),
            List.of("c_suite", "vp", "director")),
    VP_DIRECTOR(
            List.of("VP", "Vice President", "Head of Investments", "Head of Strategy", "Director", "Senior Director"),
            List.of("vp", "director", "manager")),
    BUSINESS_DEVELOPMENT(
            List.of("Business Development", "Partnerships", "Corporate Development", "Head of Growth", "Head of Sales"),
            List.of("director", "manager"));

    private final List<String> titles;
    private final List<String> seniorities;

    TitleTier(List<String> titles, List<String> seniorities) {
        this.titles = titles;
        this.seniorities = seniorities;
    }

    public List<String> getTitles() {
        return titles;
    }

    public List<String> getSeniorities() {
        return seniorities;
    }
}
