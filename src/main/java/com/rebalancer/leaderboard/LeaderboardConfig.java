package com.rebalancer.leaderboard;

import com.rebalancer.config.RebalancerProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class LeaderboardConfig {

    /** RestTemplate with connect and read timeouts set to the leaderboard timeout. */
    @Bean
    public RestTemplate leaderboardRestTemplate(
            RestTemplateBuilder restTemplateBuilder, RebalancerProperties rebalancerProperties) {
        return restTemplateBuilder
                .connectTimeout(rebalancerProperties.getLeaderboard().getTimeout())
                .readTimeout(rebalancerProperties.getLeaderboard().getTimeout())
                .build();
    }
}
