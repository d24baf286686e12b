package com.purchasingpower.newsgraph.graph.neo4j;

import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import com.purchasingpower.newsgraph.exception.BackendUnavailableException;
import com.purchasingpower.newsgraph.exception.ConfigurationException;
import com.purchasingpower.newsgraph.exception.QueryRejectedException;
import com.purchasingpower.newsgraph.graph.BackendType;
import com.purchasingpower.newsgraph.graph.cypher.AbstractCypherKnowledgeGraphStore;
import com.purchasingpower.newsgraph.graph.cypher.CypherStatement;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Query;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.AuthenticationException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Article graph on Neo4j over the Bolt protocol.
 *
 * <p>Owns one {@link Driver}. Every operation opens a short-lived session on the configured database:
 * schema statements run in auto-commit transactions, reads and writes in managed transactions.
 */
@Slf4j
public class Neo4jBoltKnowledgeGraphStore extends AbstractCypherKnowledgeGraphStore {

    private final Driver driver;
    private final String database;

    public Neo4jBoltKnowledgeGraphStore(NewsGraphProperties.Neo4j settings, int dimensions,
                                        String vectorIndexName, Clock clock) {
        this(connect(settings), settings.getDatabase(), dimensions, vectorIndexName, clock);
    }

    /**
     * Takes ownership of an already connected driver.
     */
    public Neo4jBoltKnowledgeGraphStore(Driver driver, String database, int dimensions,
                                        String vectorIndexName, Clock clock) {
        super(dimensions, vectorIndexName, clock);
        this.driver = driver;
        this.database = database;
        log.info("Initializing Neo4j Bolt store on database '{}'", database);
        initializeSchema();
    }

    @Override
    public BackendType backendType() {
        return BackendType.BOLT;
    }

    @Override
    protected List<Map<String, Object>> run(CypherStatement statement, Map<String, Object> parameters) {
        Query query = new Query(statement.text(), parameters);
        try (Session session = driver.session(SessionConfig.forDatabase(database))) {
            return switch (statement.mode()) {
                case SCHEMA -> session.run(query).list(Record::asMap);
                case READ -> session.executeRead(tx -> tx.run(query).list(Record::asMap));
                case WRITE -> session.executeWrite(tx -> tx.run(query).list(Record::asMap));
            };
        } catch (ServiceUnavailableException | SessionExpiredException e) {
            throw new BackendUnavailableException(BackendType.BOLT,
                    "Neo4j unavailable during " + statement.name() + ": " + e.getMessage(), e);
        } catch (Neo4jException e) {
            throw new QueryRejectedException(BackendType.BOLT,
                    statement.name() + " rejected [" + e.code() + "]: " + e.getMessage(), e);
        }
    }

    @Override
    protected void releaseResources() {
        driver.close();
    }

    private static Driver connect(NewsGraphProperties.Neo4j settings) {
        requireSetting("newsgraph.neo4j.uri", settings.getUri());
        requireSetting("newsgraph.neo4j.username", settings.getUsername());
        requireSetting("newsgraph.neo4j.password", settings.getPassword());

        log.info("Connecting to Neo4j at: {}", settings.getUri());
        Config config = Config.builder()
                .withConnectionTimeout(settings.getConnectionTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
        Driver driver;
        try {
            driver = GraphDatabase.driver(settings.getUri(),
                    AuthTokens.basic(settings.getUsername(), settings.getPassword()), config);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("newsgraph.neo4j.uri", "Invalid Neo4j URI: " + e.getMessage());
        }
        try {
            driver.verifyConnectivity();
            return driver;
        } catch (AuthenticationException e) {
            driver.close();
            throw new BackendUnavailableException(BackendType.BOLT,
                    "Neo4j rejected the credentials: " + e.getMessage(), e);
        } catch (Neo4jException e) {
            driver.close();
            throw new BackendUnavailableException(BackendType.BOLT,
                    "Neo4j not reachable at " + settings.getUri() + ": " + e.getMessage(), e);
        }
    }

    private static void requireSetting(String property, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(property, property + " is required for the Bolt backend");
        }
    }
}
