package com.purchasingpower.newsgraph.config;

import com.purchasingpower.newsgraph.embedding.EmbeddingProviderType;
import com.purchasingpower.newsgraph.graph.BackendType;
import com.purchasingpower.newsgraph.scenario.ScenarioDataset;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * All settings of the application, bound once from the {@code newsgraph} namespace.
 *
 * <p>The nested groups are handed to the components that need them through their constructors;
 * stores, detector and orchestrator never read the environment themselves. Validation runs at bind
 * time, so a negative limit or an out-of-range threshold stops the context before any backend is opened.
 * Example:
 * <pre>
 * newsgraph:
 *   neo4j:
 *     uri: ${NEO4J_URI}
 *     username: ${NEO4J_USERNAME}
 *     password: ${NEO4J_PASSWORD}
 *   graph:
 *     backends: [BOLT, QUERY_API, IN_MEMORY]
 *   embedding:
 *     provider: GEMINI
 *   retry:
 *     max-attempts: 3
 *     backoff-ms: 500
 * </pre>
 *
 * <p><b>Thread Safety:</b> bound once by Spring and only read afterwards.
 *
 * @author NewsGraph Pipeline
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "newsgraph")
public class NewsGraphProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Neo4j neo4j = new Neo4j();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Graph graph = new Graph();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Embedding embedding = new Embedding();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Detection detection = new Detection();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Retry retry = new Retry();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Pipeline pipeline = new Pipeline();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Scenario scenario = new Scenario();

    /**
     * Connection settings shared by the Bolt and Query API backends.
     *
     * <p>Credentials are only required by the backends that use them; an {@code IN_MEMORY}-only
     * chain starts without any of them.
     */
    @Data
    public static class Neo4j {

        /**
         * Bolt URI, e.g. {@code neo4j+s://xxxx.databases.neo4j.io}. Its host also seeds the default Query API URL.
         */
        private String uri;

        /**
         * Database user, sent as Bolt basic auth and as the Query API {@code Authorization} header.
         */
        private String username;

        private String password;

        /**
         * Database the sessions and Query API requests target.
         * Default: neo4j
         */
        @NotBlank
        private String database = "neo4j";

        /**
         * Query API URL template; {@code {databaseName}} is replaced by {@link #database}.
         * Blank means {@code https://{host-of-uri}/db/{databaseName}/query/v2}.
         */
        private String queryApiUrl;

        /**
         * Time allowed to open a connection, for both Bolt and HTTP.
         * Default: 10 seconds
         */
        @Min(1)
        private int connectionTimeoutSeconds = 10;

        /**
         * Time allowed for one Query API round trip before it counts as unavailable.
         * Default: 60 seconds
         */
        @Min(1)
        private int requestTimeoutSeconds = 60;
    }

    /**
     * Backend selection and schema names.
     */
    @Data
    public static class Graph {

        /**
         * Backends tried in order at startup until one connects and accepts the schema.
         * Default: BOLT, QUERY_API, IN_MEMORY
         */
        @NotEmpty
        private List<BackendType> backends = new ArrayList<>(List.of(
                BackendType.BOLT, BackendType.QUERY_API, BackendType.IN_MEMORY));

        /**
         * Name of the cosine vector index over {@code Article.embedding}. Word characters only,
         * because index names cannot be passed as query parameters.
         * Default: article_embedding_idx
         */
        @NotBlank
        private String vectorIndexName = "article_embedding_idx";
    }

    /**
     * Embedding provider choice and the settings of each provider.
     *
     * <p>The vector length of the chosen provider also sizes the vector index, so switching providers
     * against an existing database needs a fresh index.
     */
    @Data
    public static class Embedding {

        /**
         * Provider built at startup.
         * Default: GEMINI
         */
        @NotNull
        private EmbeddingProviderType provider = EmbeddingProviderType.GEMINI;

        /**
         * Fall back to deterministic hash embeddings when the configured provider cannot report its dimension.
         * Missing credentials still fail startup.
         * Default: true
         */
        private boolean fallbackToHash = true;

        @Valid
        @NestedConfigurationProperty
        private Gemini gemini = new Gemini();

        @Valid
        @NestedConfigurationProperty
        private Ollama ollama = new Ollama();

        @Valid
        @NestedConfigurationProperty
        private Hash hash = new Hash();
    }

    /**
     * Gemini {@code embedContent} client.
     *
     * <p><b>Backoff:</b> for retry N (starting at 0) the delay is about
     * {@code min(initialBackoffSeconds * 2^N, maxBackoffSeconds)} plus jitter, applied only to
     * responses with one of the {@link #retryableStatusCodes}.
     */
    @Data
    public static class Gemini {

        /**
         * API key sent as the {@code x-goog-api-key} header. Required when Gemini is the provider.
         */
        private String apiKey;

        private String model = "text-embedding-004";

        private String baseUrl = "https://generativelanguage.googleapis.com";

        private String apiVersion = "v1beta";

        /**
         * Retries after the first call.
         * Default: 3
         */
        @Min(0)
        private int maxRetries = 3;

        @Min(1)
        private long initialBackoffSeconds = 2;

        @Min(1)
        private long maxBackoffSeconds = 20;

        /**
         * HTTP status codes retried with exponential backoff.
         */
        private List<Integer> retryableStatusCodes = new ArrayList<>(List.of(429, 500, 502, 503, 504));
    }

    /**
     * Local Ollama server reached through LangChain4j.
     */
    @Data
    public static class Ollama {

        private String baseUrl = "http://localhost:11434";

        private String model = "mxbai-embed-large";

        @Min(1)
        private int timeoutSeconds = 120;

        @Min(0)
        private int maxRetries = 3;
    }

    @Data
    public static class Hash {

        /**
         * Length of the generated vectors.
         * Default: 256
         */
        @Min(1)
        private int dimensions = 256;
    }

    /**
     * Default policy of the standalone duplicate detector.
     */
    @Data
    public static class Detection {

        /**
         * Lowest cosine similarity reported as a duplicate.
         * Range: -1.0 to 1.0
         * Default: 0.88
         */
        @DecimalMin("-1.0")
        @DecimalMax("1.0")
        private double minScore = 0.88;

        /**
         * Most duplicates linked per article.
         * Default: 5
         */
        @Min(1)
        private int limit = 5;
    }

    /**
     * Retry of idempotent graph writes when the backend is unavailable.
     * For attempt N (starting at 0) the delay is {@code min(backoffMs * multiplier^N, maxBackoffMs)}.
     * Example with defaults: 0.5s, 1s, 2s, then capped at 5s
     */
    @Data
    public static class Retry {

        /**
         * Total attempts, including the first one.
         * Default: 3
         */
        @Min(1)
        private int maxAttempts = 3;

        @Min(0)
        private long backoffMs = 500;

        @Min(0)
        private long maxBackoffMs = 5000;

        @DecimalMin("1.0")
        private double multiplier = 2.0;
    }

    /**
     * Orchestrator settings: the duplicate threshold of batch runs and the parameters of the query catalog.
     */
    @Data
    public static class Pipeline {

        /**
         * Lowest cosine similarity linked during a batch run. Lower than {@link Detection#getMinScore()}
         * so that short recaps still meet their originals.
         * Range: -1.0 to 1.0
         * Default: 0.4
         */
        @DecimalMin("-1.0")
        @DecimalMax("1.0")
        private double duplicateThreshold = 0.4;

        @Min(1)
        private int duplicateLimit = 5;

        /**
         * Window of the weekly digest query.
         * Default: 7 days
         */
        @Min(1)
        private int digestDays = 7;

        /**
         * Entity whose recent mentions the catalog lists.
         */
        @NotBlank
        private String entityName = "OpenAI";

        @Min(1)
        private int entityDays = 14;

        /**
         * Topic whose related projects the catalog lists.
         */
        @NotBlank
        private String projectTopic = "Vision-Language Models";

        /**
         * Topic searched on matching articles to show their related projects.
         */
        @NotBlank
        private String topicMarker = "Image Edit";
    }

    /**
     * Optional startup run of a bundled or file-based article batch.
     */
    @Data
    public static class Scenario {

        /**
         * Run the dataset through the pipeline on startup and log the report.
         * Default: false
         */
        private boolean enabled = false;

        /**
         * Articles fed to the run.
         * Default: SYNTHETIC
         */
        @NotNull
        private ScenarioDataset dataset = ScenarioDataset.SYNTHETIC;

        /**
         * JSON array of articles, used when {@link #dataset} is {@code FILE}.
         */
        private String inputFile;
    }
}
