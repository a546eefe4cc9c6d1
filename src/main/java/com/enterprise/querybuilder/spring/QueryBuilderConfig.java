package com.enterprise.querybuilder.spring;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the query builder.
 *
 * <p>Binds {@code querybuilder.*} properties and provides a
 * {@link QueryBuilderFactory} bean. Import it or let component scanning
 * pick it up:
 * <pre>{@code
 * @Import(QueryBuilderConfig.class)
 * @Configuration
 * public class RepositoryConfig { ... }
 * }</pre>
 */
@Configuration
@EnableConfigurationProperties(QueryBuilderProperties.class)
public class QueryBuilderConfig {

    @Bean
    public QueryBuilderFactory queryBuilderFactory(QueryBuilderProperties properties) {
        return QueryBuilderFactory.from(properties);
    }
}
