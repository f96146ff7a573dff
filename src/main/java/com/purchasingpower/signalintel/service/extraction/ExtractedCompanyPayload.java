package com.purchasingpower.signalintel.service.extraction;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * One company object as the model returns it. Field names vary between camelCase and
 * snake_case across backends, hence the aliases. {@code companyDomain} is read only for logging.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractedCompanyPayload {

    @JsonAlias({"company_name", "name"})
    private String companyName;

    @JsonAlias({"company_domain", "domain"})
    private String companyDomain;

    @JsonAlias({"signal_type", "type"})
    private String signalType;

    @JsonAlias({"signal_title", "signalHeadline", "title"})
    private String signalTitle;

    @JsonAlias({"signal_date", "date"})
    private String signalDate;

    @JsonAlias("source_type")
    private String sourceType;

    @JsonAlias("match_confidence")
    private Double confidence;

    @JsonAlias({"resultIndex", "result_index"})
    private Integer index;

    public boolean hasName() {
        return companyName != null && !companyName.isBlank();
    }
}
