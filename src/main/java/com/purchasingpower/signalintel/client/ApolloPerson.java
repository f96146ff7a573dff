package com.purchasingpower.signalintel.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Person record as returned by Apollo people search and enrich.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApolloPerson(
        String id,
        String name,
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        String title,
        String email,
        @JsonProperty("linkedin_url") String linkedinUrl) {

    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        String joined = ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
        return joined.isEmpty() ? null : joined;
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }
}
