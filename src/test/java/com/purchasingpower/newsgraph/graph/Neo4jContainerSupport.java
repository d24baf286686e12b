package com.purchasingpower.newsgraph.graph;

import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Session;
import org.testcontainers.containers.Neo4jContainer;
import org.testcontainers.utility.DockerImageName;

import java.util.List;

/**
 * One Neo4j 5 container shared by every Docker-backed test in the JVM, started on first use.
 */
public final class Neo4jContainerSupport {

    public static final String PASSWORD = "newsgraph-test";

    private static Neo4jContainer<?> container;

    private Neo4jContainerSupport() {
    }

    public static synchronized Neo4jContainer<?> neo4j() {
        if (container == null) {
            container = new Neo4jContainer<>(DockerImageName.parse("neo4j:5.26"))
                    .withAdminPassword(PASSWORD)
                    .withNeo4jConfig("server.http.enabled_modules",
                            "TRANSACTIONAL_ENDPOINTS,UNMANAGED_EXTENSIONS,BROWSER,QUERY_API_ENDPOINTS");
            container.start();
        }
        return container;
    }

    public static NewsGraphProperties.Neo4j settings() {
        Neo4jContainer<?> neo4j = neo4j();
        NewsGraphProperties.Neo4j settings = new NewsGraphProperties.Neo4j();
        settings.setUri(neo4j.getBoltUrl());
        settings.setUsername("neo4j");
        settings.setPassword(PASSWORD);
        settings.setDatabase("neo4j");
        settings.setQueryApiUrl(neo4j.getHttpUrl() + "/db/{databaseName}/query/v2");
        return settings;
    }

    /**
     * Deletes all nodes, relationships and vector indexes so the next store can create its own index.
     */
    public static void clearGraph() {
        Neo4jContainer<?> neo4j = neo4j();
        try (Driver driver = GraphDatabase.driver(neo4j.getBoltUrl(), AuthTokens.basic("neo4j", PASSWORD));
             Session session = driver.session()) {
            session.run("MATCH (n) DETACH DELETE n").consume();
            List<String> vectorIndexes = session.run("SHOW VECTOR INDEXES YIELD name RETURN name")
                    .list(record -> record.get("name").asString());
            for (String name : vectorIndexes) {
                session.run("DROP INDEX " + name + " IF EXISTS").consume();
            }
        }
    }
}
