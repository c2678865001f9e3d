package com.phillippitts.lineconsensus.config.cluster;

import com.phillippitts.lineconsensus.config.properties.ClusteringProperties;
import com.phillippitts.lineconsensus.service.cluster.ClusteringAdapter;
import com.phillippitts.lineconsensus.service.cluster.DensityThresholdAdvisor;
import com.phillippitts.lineconsensus.service.cluster.optics.OpticsClusteringAdapter;
import com.phillippitts.lineconsensus.service.consensus.ClusterAggregator;
import com.phillippitts.lineconsensus.service.consensus.SingletonSynthesizer;
import com.phillippitts.lineconsensus.service.consensus.impl.PositionalClusterAggregator;
import com.phillippitts.lineconsensus.service.reduce.DefaultFrameReducer;
import com.phillippitts.lineconsensus.service.reduce.FrameReducer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the consensus pipeline. The clustering collaborator and the cluster aggregator are
 * replaceable: declaring another bean of either type takes precedence over the defaults.
 */
@Configuration
public class ClusteringConfig {

    private static final Logger LOG = LogManager.getLogger(ClusteringConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public ClusteringAdapter clusteringAdapter(ClusteringProperties props) {
        LOG.info("Using OPTICS clustering with eps={}", props.getEps());
        return new OpticsClusteringAdapter(props.getEps());
    }

    @Bean
    public DensityThresholdAdvisor densityThresholdAdvisor(ClusteringProperties props) {
        DensityThresholdAdvisor advisor = new DensityThresholdAdvisor(props.getMinSamples());
        if (!advisor.isAuto()) {
            LOG.info("Using fixed min_samples={}", props.getMinSamples());
        }
        return advisor;
    }

    @Bean
    @ConditionalOnMissingBean
    public ClusterAggregator clusterAggregator() {
        return new PositionalClusterAggregator();
    }

    @Bean
    public SingletonSynthesizer singletonSynthesizer() {
        return new SingletonSynthesizer();
    }

    @Bean
    public FrameReducer frameReducer(ClusteringAdapter clusteringAdapter,
                                     DensityThresholdAdvisor densityThresholdAdvisor,
                                     ClusterAggregator clusterAggregator,
                                     SingletonSynthesizer singletonSynthesizer) {
        return new DefaultFrameReducer(clusteringAdapter, densityThresholdAdvisor,
                clusterAggregator, singletonSynthesizer);
    }
}
