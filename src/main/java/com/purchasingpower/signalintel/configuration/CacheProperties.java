package com.purchasingpower.signalintel.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class CacheProperties {

    private boolean enabled = true;

    @NotNull
    private Duration ttl = Duration.ofHours(24);

    @NotBlank
    private String purgeCron = "0 15 * * * *";
}
