package com.purchasingpower.signalintel.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ExtractionProperties {

    @Min(1)
    private int maxContextHits = 25;

    /**
     * Body characters of each hit sent to the model.
     */
    @Min(100)
    private int maxTextChars = 1500;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minConfidence = 0.3;

    /**
     * Confidence assumed when the model omits it.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double defaultConfidence = 0.8;
}
