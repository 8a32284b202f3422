package com.skyfare.fareservice.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "comparison")
public class ComparisonProperties {

    /**
     * Upper bound on searches in flight at once during a comparison.
     */
    @Min(1)
    @Max(16)
    private int maxConcurrency = 2;

    /**
     * Offers requested per date. Only the first one is used.
     */
    @Min(1)
    private int offersPerDate = 5;

    /**
     * Above this many dates a comparison logs a slowness warning.
     */
    @Min(1)
    private int largeBatchThreshold = 31;

    /**
     * Hard cap on dates per comparison.
     */
    @Min(1)
    private int maxDates = 120;
}
