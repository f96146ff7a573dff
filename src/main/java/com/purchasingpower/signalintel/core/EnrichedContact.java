package com.purchasingpower.signalintel.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Decision-maker resolved for a company. A missing contact is represented by {@code null}
 * on the owning {@link IntelligenceResult}, not by an empty instance.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichedContact {

    public static final String SOURCE_APOLLO = "apollo";

    private String fullName;

    private String firstName;

    private String title;

    private String email;

    private String profileUrl;

    @Builder.Default
    private Seniority seniority = Seniority.OTHER;

    private String source;

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}
