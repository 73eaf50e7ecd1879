package kr.jemi.zseat.config;

import io.hypersistence.tsid.TSID;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TsidConfig {

    @Bean
    public TSID.Factory tsidFactory(@Value("${zseat.tsid.node-bits}") int nodeBits,
                                    @Value("${zseat.tsid.node-id}") int nodeId) {
        int maxNodeCount = 1 << nodeBits;

        return TSID.Factory.builder()
                .withNodeBits(nodeBits)
                .withNode(nodeId % maxNodeCount)
                .build();
    }
}
