package com.purchasingpower.signalintel.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Externally visible unit: a ranked company with at most one contact.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntelligenceResult {

    private Candidate company;

    private EnrichedContact contact;

    public static IntelligenceResult withoutContact(Candidate company) {
        return new IntelligenceResult(company, null);
    }
}
