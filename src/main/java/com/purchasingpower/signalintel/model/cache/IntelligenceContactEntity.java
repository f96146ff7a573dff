package com.purchasingpower.signalintel.model.cache;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Contact resolved for a cached result. Maps to the intelligence_contacts table; zero or one
 * row per result.
 */
@Entity
@Table(name = "intelligence_contacts")
@Getter
@Setter
@NoArgsConstructor
public class IntelligenceContactEntity {

    public static final String STATUS_FOUND = "found";
    public static final String STATUS_NOT_FOUND = "not_found";

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "intel_contact_seq")
    @SequenceGenerator(name = "intel_contact_seq", sequenceName = "intel_contact_seq", allocationSize = 1)
    @Column(name = "id")
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "result_id", nullable = false, unique = true)
    private IntelligenceResultEntity result;

    @Column(name = "full_name", length = 255)
    private String fullName;

    @Column(name = "first_name", length = 255)
    private String firstName;

    @Column(name = "title", length = 500)
    private String title;

    @Column(name = "email", length = 320)
    private String email;

    @Column(name = "linkedin_url", length = 1000)
    private String linkedinUrl;

    @Column(name = "seniority_level", length = 50)
    private String seniorityLevel;

    @Column(name = "enrichment_source", length = 50)
    private String enrichmentSource;

    /**
     * {@value #STATUS_FOUND} when an email was obtained, {@value #STATUS_NOT_FOUND} otherwise.
     */
    @Column(name = "enrichment_status", length = 20)
    private String enrichmentStatus;
}
