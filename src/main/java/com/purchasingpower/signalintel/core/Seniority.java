package com.purchasingpower.signalintel.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Seniority bucket of a resolved contact, inferred from the free-text job title.
 *
 * @since 1.0.0
 */
public enum Seniority {
    C_SUITE("c_suite", Pattern.compile("\\b(ceo|cfo|cto|coo|cmo|cro|cpo|chro|chief|founder|co-founder|owner|president)\\b")),
    VP("vp", Pattern.compile("\\b(vp|vice president|svp|evp)\\b")),
    DIRECTOR("director", Pattern.compile("\\b(director|head of|principal)\\b")),
    MANAGER("manager", Pattern.compile("\\b(manager|lead|senior)\\b")),
    OTHER("other", null);

    private final String wireValue;
    private final Pattern keywords;

    Seniority(String wireValue, Pattern keywords) {
        this.wireValue = wireValue;
        this.keywords = keywords;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Buckets are checked from most to least senior; the first match wins.
     */
    public static Seniority fromTitle(String title) {
        if (title == null || title.isBlank()) {
            return OTHER;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        for (Seniority seniority : values()) {
            if (seniority.keywords != null && seniority.keywords.matcher(lower).find()) {
                return seniority;
            }
        }
        return OTHER;
    }

    @JsonCreator
    public static Seniority parse(String raw) {
        if (raw == null) {
            return OTHER;
        }
        for (Seniority seniority : values()) {
            if (seniority.wireValue.equalsIgnoreCase(raw.trim())) {
                return seniority;
            }
        }
        return OTHER;
    }
}
