package com.phillippitts.lineconsensus.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for consensus clustering.
 */
@Validated
@ConfigurationProperties(prefix = "consensus.clustering")
public class ClusteringProperties {

    static final double DEFAULT_EPS = 30.0;

    /**
     * Fixed min_samples for density clustering. 0 derives it from the number of contributors.
     */
    @Min(0)
    private final int minSamples;

    /**
     * Reachability threshold at which the OPTICS ordering is cut into clusters.
     * Same unit as the dissimilarity: pixels of endpoint drift plus edited characters.
     */
    @Positive
    private final double eps;

    @ConstructorBinding
    public ClusteringProperties(Integer minSamples, Double eps) {
        int ms = minSamples == null ? 0 : minSamples;
        if (ms < 0) {
            throw new IllegalArgumentException("consensus.clustering.min-samples must be >= 0");
        }
        double e = eps == null ? DEFAULT_EPS : eps;
        if (!(e > 0.0) || Double.isInfinite(e)) {
            throw new IllegalArgumentException("consensus.clustering.eps must be a positive finite number");
        }
        this.minSamples = ms;
        this.eps = e;
    }

    // Defaults for tests and manual instantiation
    public ClusteringProperties() {
        this(null, null);
    }

    public int getMinSamples() {
        return minSamples;
    }

    public double getEps() {
        return eps;
    }
}
