package com.purchasingpower.signalintel.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private CredentialProperties credentials = new CredentialProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SearchProperties search = new SearchProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private LlmProperties llm = new LlmProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ExtractionProperties extraction = new ExtractionProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private FallbackProperties fallback = new FallbackProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private EnrichmentProperties enrichment = new EnrichmentProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private CacheProperties cache = new CacheProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ScoringProperties scoring = new ScoringProperties();
}
