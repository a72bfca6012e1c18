package com.memberhub.search.service;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SearchLimitsProperties.class)
public class SearchLimitsConfig {
}
