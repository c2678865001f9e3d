package com.phillippitts.lineconsensus;

import com.phillippitts.lineconsensus.config.properties.ClusteringProperties;
import com.phillippitts.lineconsensus.config.properties.ReductionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ClusteringProperties.class,
        ReductionProperties.class
})
public class LineConsensusApplication {

    public static void main(String[] args) {
        SpringApplication.run(LineConsensusApplication.class, args);
    }

}
