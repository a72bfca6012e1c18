package com.memberhub.search.merge;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FusionPolicyProperties.class)
public class FusionPolicyConfig {
}
