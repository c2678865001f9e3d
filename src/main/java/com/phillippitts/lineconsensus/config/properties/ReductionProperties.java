package com.phillippitts.lineconsensus.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for batch reduction.
 */
@Validated
@ConfigurationProperties(prefix = "consensus.reduction")
public class ReductionProperties {

    /**
     * Time budget in milliseconds for a whole batch of subjects. Subjects still running when it
     * expires are reported as failed.
     */
    @Min(1)
    private final long timeoutMs;

    @ConstructorBinding
    public ReductionProperties(Long timeoutMs) {
        this.timeoutMs = timeoutMs == null || timeoutMs <= 0 ? 30_000L : timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
