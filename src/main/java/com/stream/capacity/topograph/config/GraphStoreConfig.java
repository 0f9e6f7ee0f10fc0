package com.stream.capacity.topograph.config;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthToken;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single long-lived connection to the graph store, shared by every snapshot build.
 * The driver connects lazily; it is closed with the application context.
 */
@Configuration
@Slf4j
public class GraphStoreConfig {

    static final String GRAPH_STORE_URL_PROPERTY = "topograph.graph-store.url";

    @Value("${" + GRAPH_STORE_URL_PROPERTY + ":}")
    private String graphStoreUrl;

    @Value("${topograph.graph-store.username:}")
    private String username;

    @Value("${topograph.graph-store.password:}")
    private String password;

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver() {
        String uri = EndpointResolver.require(GRAPH_STORE_URL_PROPERTY, graphStoreUrl);
        log.info("Connecting to graph database at: {}", uri);
        return GraphDatabase.driver(uri, authToken());
    }

    private AuthToken authToken() {
        if (username == null || username.isBlank()) {
            return AuthTokens.none();
        }
        return AuthTokens.basic(username, password);
    }
}
