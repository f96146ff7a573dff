package com.purchasingpower.signalintel.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of page a signal was found on.
 *
 * @since 1.0.0
 */
public enum SourceType {
    COMPANY_PAGE("company_page"),
    NEWS("news"),
    JOB_POSTING("job_posting"),
    PRESS_RELEASE("press_release");

    private final String wireValue;

    SourceType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Unknown or missing values map to {@link #NEWS}.
     */
    @JsonCreator
    public static SourceType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NEWS;
        }
        String normalized = raw.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .replace(' ', '_')
                .toLowerCase(Locale.ROOT);
        for (SourceType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        return NEWS;
    }
}
