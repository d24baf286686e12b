package com.purchasingpower.newsgraph.graph.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.newsgraph.config.NewsGraphProperties;
import com.purchasingpower.newsgraph.exception.BackendUnavailableException;
import com.purchasingpower.newsgraph.exception.ConfigurationException;
import com.purchasingpower.newsgraph.exception.QueryRejectedException;
import com.purchasingpower.newsgraph.graph.BackendType;
import com.purchasingpower.newsgraph.graph.cypher.AbstractCypherKnowledgeGraphStore;
import com.purchasingpower.newsgraph.graph.cypher.CypherStatement;
import com.purchasingpower.newsgraph.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import io.netty.channel.ChannelOption;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Article graph on Neo4j through the HTTP Query API ({@code POST /db/{database}/query/v2}).
 *
 * <p>Used where Bolt is blocked. Each statement is one implicit transaction; the columnar
 * {@code {"data": {"fields": [...], "values": [[...]]}}} answer is zipped into row maps.
 *
 * <p>Owns one Reactor Netty {@link ConnectionProvider}, created after the settings are validated and
 * disposed by {@link #close()}.
 */
@Slf4j
public class Neo4jQueryApiKnowledgeGraphStore extends AbstractCypherKnowledgeGraphStore {

    private static final String DEFAULT_URL_TEMPLATE = "https://%s/db/{databaseName}/query/v2";
    private static final int MAX_CONNECTIONS = 4;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String queryUrl;
    private final Duration requestTimeout;
    private final ConnectionProvider connectionProvider;

    public Neo4jQueryApiKnowledgeGraphStore(NewsGraphProperties.Neo4j settings, int dimensions,
                                            String vectorIndexName, Clock clock) {
        this(settings, WebClient.builder(), new ObjectMapper(), dimensions, vectorIndexName, clock);
    }

    Neo4jQueryApiKnowledgeGraphStore(NewsGraphProperties.Neo4j settings, WebClient.Builder webClientBuilder,
                                     ObjectMapper objectMapper, int dimensions, String vectorIndexName,
                                     Clock clock) {
        this(settings, webClientBuilder, Neo4jQueryApiKnowledgeGraphStore::newConnectionProvider, objectMapper,
                dimensions, vectorIndexName, clock);
    }

    Neo4jQueryApiKnowledgeGraphStore(NewsGraphProperties.Neo4j settings, WebClient.Builder webClientBuilder,
                                     Supplier<ConnectionProvider> connectionProviderFactory,
                                     ObjectMapper objectMapper, int dimensions, String vectorIndexName,
                                     Clock clock) {
        super(dimensions, vectorIndexName, clock);
        requireSetting("newsgraph.neo4j.username", settings.getUsername());
        requireSetting("newsgraph.neo4j.password", settings.getPassword());
        this.queryUrl = resolveQueryUrl(settings);
        this.objectMapper = objectMapper;
        this.requestTimeout = Duration.ofSeconds(settings.getRequestTimeoutSeconds());
        this.connectionProvider = connectionProviderFactory.get();
        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, settings.getConnectionTimeoutSeconds() * 1000)
                .responseTimeout(requestTimeout);
        this.webClient = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeaders(headers -> {
                    headers.setBasicAuth(settings.getUsername(), settings.getPassword());
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
                })
                .build();
        log.info("Initializing Neo4j Query API store at: {}", queryUrl);
        initializeSchema();
    }

    @Override
    public BackendType backendType() {
        return BackendType.QUERY_API;
    }

    public String queryUrl() {
        return queryUrl;
    }

    @Override
    protected List<Map<String, Object>> run(CypherStatement statement, Map<String, Object> parameters) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("statement", statement.text());
        body.put("parameters", parameters);
        if (statement.mode() == CypherStatement.Mode.READ) {
            body.put("accessMode", "READ");
        }

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(queryUrl)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(requestTimeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new QueryRejectedException(BackendType.QUERY_API,
                    String.format("%s rejected with HTTP %d", statement.name(), e.getStatusCode().value()),
                    e.getResponseBodyAsString());
        } catch (WebClientRequestException e) {
            throw new BackendUnavailableException(BackendType.QUERY_API,
                    "Query API not reachable at " + queryUrl + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new BackendUnavailableException(BackendType.QUERY_API,
                        statement.name() + " timed out after " + requestTimeout.toSeconds() + "s", cause);
            }
            throw e;
        }
        return toRows(statement, response);
    }

    @Override
    protected void releaseResources() {
        connectionProvider.dispose();
    }

    private static ConnectionProvider newConnectionProvider() {
        return ConnectionProvider.builder("neo4j-query-api")
                .maxConnections(MAX_CONNECTIONS)
                .maxIdleTime(Duration.ofSeconds(30))
                .build();
    }

    private List<Map<String, Object>> toRows(CypherStatement statement, JsonNode response) {
        if (response == null) {
            return List.of();
        }
        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new QueryRejectedException(BackendType.QUERY_API,
                    statement.name() + " rejected: " + errors.get(0).path("message").asText(),
                    ExternalCallLogger.truncate(errors.toString(), 2000));
        }
        JsonNode fields = response.path("data").path("fields");
        JsonNode values = response.path("data").path("values");
        if (!fields.isArray() || !values.isArray()) {
            return List.of();
        }
        List<Map<String, Object>> rows = new ArrayList<>(values.size());
        for (JsonNode value : values) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < fields.size(); i++) {
                row.put(fields.get(i).asText(), objectMapper.convertValue(value.get(i), Object.class));
            }
            rows.add(row);
        }
        return rows;
    }

    static String resolveQueryUrl(NewsGraphProperties.Neo4j settings) {
        String template = settings.getQueryApiUrl();
        if (template == null || template.isBlank()) {
            template = String.format(DEFAULT_URL_TEMPLATE, hostOf(settings.getUri()));
        }
        return template.replace("{databaseName}", settings.getDatabase());
    }

    private static String hostOf(String uri) {
        requireSetting("newsgraph.neo4j.uri", uri);
        String host;
        try {
            host = URI.create(uri).getHost();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("newsgraph.neo4j.uri", "Invalid Neo4j URI: " + uri);
        }
        if (host == null) {
            throw new ConfigurationException("newsgraph.neo4j.uri", "Neo4j URI must include a hostname: " + uri);
        }
        return host;
    }

    private static void requireSetting(String property, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(property, property + " is required for the Query API backend");
        }
    }
}
