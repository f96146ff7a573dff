package com.purchasingpower.signalintel.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Business signal a company exhibits in a search hit.
 *
 * <p>Wire values are snake_case; {@link #parse(String)} is lenient because
 * model output mixes casing styles.
 *
 * @since 1.0.0
 */
public enum SignalType {
    FUNDING("funding"),
    HIRING("hiring"),
    EXPANSION("expansion"),
    EXEC_CHANGE("exec_change"),
    ACQUISITION("acquisition"),
    PARTNERSHIP("partnership"),
    CERTIFICATION("certification"),
    OTHER("other");

    private final String wireValue;

    SignalType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static SignalType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        String normalized = raw.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .replace(' ', '_')
                .toLowerCase(Locale.ROOT);
        for (SignalType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
