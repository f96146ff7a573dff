package com.purchasingpower.signalintel.configuration;

import lombok.Data;

/**
 * Server-side default credentials. Each value is used only when the caller did not
 * send the matching header, so every field is optional.
 */
@Data
public class CredentialProperties {

    private String exaApiKey;

    private String openaiApiKey;

    private String azureApiKey;

    private String azureEndpoint;

    private String azureDeployment = "gpt-4o-mini";

    private String anthropicApiKey;

    private String apolloApiKey;
}
