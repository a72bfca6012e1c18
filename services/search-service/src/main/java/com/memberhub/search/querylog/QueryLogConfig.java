package com.memberhub.search.querylog;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(QueryLogProperties.class)
public class QueryLogConfig {
}
