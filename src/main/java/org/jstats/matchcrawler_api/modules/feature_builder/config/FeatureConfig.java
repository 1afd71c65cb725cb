package org.jstats.matchcrawler_api.modules.feature_builder.config;

import org.jstats.matchcrawler_api.modules.feature_builder.service.ImputationPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FeatureProperties.class)
public class FeatureConfig {

    @Bean
    ImputationPolicy imputationPolicy(FeatureProperties props) {
        return ImputationPolicy.withOverrides(props.imputation());
    }
}
