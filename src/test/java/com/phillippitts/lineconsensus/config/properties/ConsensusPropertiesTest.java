package com.phillippitts.lineconsensus.config.properties;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsensusPropertiesTest {

    @Test
    void clusteringDefaultsToAutoMinSamplesAndEps30() {
        ClusteringProperties props = new ClusteringProperties();

        assertThat(props.getMinSamples()).isZero();
        assertThat(props.getEps()).isEqualTo(30.0);
    }

    @Test
    void clusteringKeepsExplicitValues() {
        ClusteringProperties props = new ClusteringProperties(4, 12.5);

        assertThat(props.getMinSamples()).isEqualTo(4);
        assertThat(props.getEps()).isEqualTo(12.5);
    }

    @Test
    void clusteringRejectsInvalidValues() {
        assertThatThrownBy(() -> new ClusteringProperties(-1, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ClusteringProperties(null, 0.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reductionTimeoutDefaultsTo30Seconds() {
        assertThat(new ReductionProperties(null).getTimeoutMs()).isEqualTo(30_000L);
        assertThat(new ReductionProperties(0L).getTimeoutMs()).isEqualTo(30_000L);
        assertThat(new ReductionProperties(500L).getTimeoutMs()).isEqualTo(500L);
    }

    @Test
    void reductionPoolDefaults() {
        ThreadPoolProperties.ReductionPoolProperties pool = new ThreadPoolProperties().getReduction();

        assertThat(pool.getCorePoolSize()).isEqualTo(4);
        assertThat(pool.getMaxPoolSize()).isEqualTo(8);
        assertThat(pool.getQueueCapacity()).isEqualTo(100);
        assertThat(pool.getKeepAliveSeconds()).isEqualTo(60);
        assertThat(pool.getThreadNamePrefix()).isEqualTo("reduce-pool-");
    }
}
