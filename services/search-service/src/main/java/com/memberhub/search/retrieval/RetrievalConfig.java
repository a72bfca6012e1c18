package com.memberhub.search.retrieval;

import com.memberhub.search.retrieval.lexical.LexicalSearchProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({VectorSearchProperties.class, LexicalSearchProperties.class})
public class RetrievalConfig {
}
