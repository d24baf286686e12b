package com.purchasingpower.newsgraph.graph.cypher;

import com.purchasingpower.newsgraph.graph.cypher.CypherStatement.Mode;

/**
 * The statement catalog shared by the Bolt and Query API backends.
 *
 * <p>Each contract operation is exactly one statement. Temporal values are passed in as ISO-8601 strings
 * and dates are returned as strings, so both transports see identical values.
 */
public final class CypherStatements {

    public static final CypherStatement ARTICLE_CONSTRAINT = new CypherStatement("ensureConstraint", """
            CREATE CONSTRAINT article_message_id_unique IF NOT EXISTS
            FOR (a:Article) REQUIRE a.messageId IS UNIQUE
            """, Mode.SCHEMA);

    public static final CypherStatement AWAIT_INDEXES = new CypherStatement("awaitIndexes",
            "CALL db.awaitIndexes(300)", Mode.SCHEMA);

    public static final CypherStatement UPSERT_ARTICLE = new CypherStatement("upsertArticle", """
            MERGE (a:Article {messageId: $messageId})
            SET a.ingestedAt = coalesce(a.ingestedAt, datetime($ingestedAt)),
                a.title = $title,
                a.body = $body,
                a.url = $url,
                a.sourceChannel = $sourceChannel,
                a.publishedAt = datetime($publishedAt),
                a.embedding = $embedding,
                a.status = 'ingested'
            """, Mode.WRITE);

    public static final CypherStatement ATTACH_TOPICS = new CypherStatement("attachTopics", """
            MATCH (a:Article {messageId: $messageId})
            FOREACH (topicName IN $topics |
                MERGE (t:Topic {name: topicName})
                ON CREATE SET t.createdAt = datetime()
                MERGE (a)-[:ABOUT]->(t)
            )
            """, Mode.WRITE);

    public static final CypherStatement ATTACH_ENTITIES = new CypherStatement("attachEntities", """
            MATCH (a:Article {messageId: $messageId})
            FOREACH (entity IN $entities |
                MERGE (e:Entity {name: entity.name})
                ON CREATE SET e.createdAt = datetime()
                SET e.type = entity.type
                MERGE (a)-[:MENTIONS]->(e)
            )
            """, Mode.WRITE);

    public static final CypherStatement ATTACH_PROJECTS = new CypherStatement("attachProjects", """
            MATCH (a:Article {messageId: $messageId})
            FOREACH (project IN $projects |
                MERGE (p:Project {name: project.name})
                ON CREATE SET p.createdAt = datetime()
                SET p.description = coalesce(project.description, p.description)
                MERGE (a)-[:FEATURES]->(p)
                FOREACH (topicName IN project.topics |
                    MERGE (t:Topic {name: topicName})
                    ON CREATE SET t.createdAt = datetime()
                    MERGE (p)-[:ABOUT]->(t)
                )
            )
            """, Mode.WRITE);

    /**
     * The vector index reports cosine scores normalized to {@code (1 + cos) / 2}; they are mapped back to
     * cosine so thresholds mean the same on every backend. One extra candidate is fetched so the excluded
     * article cannot crowd out a real match.
     */
    public static final CypherStatement FIND_SIMILAR = new CypherStatement("findSimilarArticles", """
            CALL db.index.vector.queryNodes($indexName, $candidates, $embedding)
            YIELD node, score
            WITH node, 2 * score - 1 AS similarity
            WHERE node.messageId <> $excludingId AND similarity >= $minScore
            RETURN node.messageId AS messageId,
                   node.title AS title,
                   node.url AS url,
                   similarity AS score
            ORDER BY score DESC, messageId ASC
            LIMIT $limit
            """, Mode.READ);

    /**
     * Links only to articles ingested no later than the source and never against an existing edge in the
     * opposite direction, so re-running a batch keeps one edge per pair.
     */
    public static final CypherStatement CREATE_SIMILARITY_LINKS = new CypherStatement("createSimilarityLinks", """
            UNWIND $matches AS match
            MATCH (source:Article {messageId: $sourceId})
            MATCH (target:Article {messageId: match.messageId})
            WHERE source <> target
              AND target.ingestedAt <= source.ingestedAt
              AND NOT (target)-[:SIMILAR_TO]->(source)
            MERGE (source)-[r:SIMILAR_TO]->(target)
            SET r.score = match.score,
                r.lastChecked = datetime($checkedAt)
            RETURN target.messageId AS messageId
            """, Mode.WRITE);

    public static final CypherStatement FIND_SIMILARITY_LINKS = new CypherStatement("findSimilarityLinks", """
            MATCH (source:Article {messageId: $sourceId})-[r:SIMILAR_TO]->(target:Article)
            RETURN source.messageId AS sourceId,
                   target.messageId AS targetId,
                   r.score AS score,
                   toString(r.lastChecked) AS lastChecked
            ORDER BY score DESC, targetId ASC
            """, Mode.READ);

    public static final CypherStatement WEEKLY_DIGEST = new CypherStatement("weeklyDigest", """
            MATCH (a:Article)
            WHERE a.publishedAt >= datetime() - duration({days: $days})
            OPTIONAL MATCH (a)-[:ABOUT]->(t:Topic)
            WITH a, t ORDER BY t.name
            WITH a, collect(DISTINCT t.name) AS topics
            RETURN toString(date(a.publishedAt)) AS day,
                   a.title AS title,
                   a.url AS url,
                   topics
            ORDER BY day DESC, title ASC
            """, Mode.READ);

    public static final CypherStatement ARTICLES_BY_ENTITY = new CypherStatement("articleListByEntity", """
            MATCH (a:Article)-[:MENTIONS]->(:Entity {name: $entity})
            WHERE a.publishedAt >= datetime() - duration({days: $days})
            RETURN a.title AS title,
                   a.url AS url,
                   toString(date(a.publishedAt)) AS day
            ORDER BY a.publishedAt DESC, title ASC
            """, Mode.READ);

    public static final CypherStatement PROJECTS_BY_TOPIC = new CypherStatement("vlmProjects", """
            MATCH (a:Article)-[:FEATURES]->(p:Project)-[:ABOUT]->(:Topic {name: $topic})
            RETURN p.name AS project,
                   a.title AS title,
                   a.url AS url,
                   toString(date(a.publishedAt)) AS day
            ORDER BY a.publishedAt DESC, project ASC, title ASC
            """, Mode.READ);

    public static final CypherStatement ARTICLES_BY_TOPIC_MARKER = new CypherStatement("imageEditNews", """
            MATCH (a:Article)-[:ABOUT]->(t:Topic)
            WHERE t.name CONTAINS $marker
            WITH a, t ORDER BY t.name
            WITH a, collect(DISTINCT t.name) AS topics
            RETURN a.title AS title,
                   a.url AS url,
                   toString(date(a.publishedAt)) AS day,
                   topics
            ORDER BY day DESC, title ASC
            """, Mode.READ);

    public static final CypherStatement STATS = new CypherStatement("stats", """
            RETURN COUNT { MATCH (:Article) } AS articles,
                   COUNT { MATCH (:Topic) } AS topics,
                   COUNT { MATCH (:Entity) } AS entities,
                   COUNT { MATCH (:Project) } AS projects,
                   COUNT { MATCH ()-[:ABOUT]->() } AS aboutRelations,
                   COUNT { MATCH ()-[:MENTIONS]->() } AS mentionsRelations,
                   COUNT { MATCH ()-[:FEATURES]->() } AS featuresRelations,
                   COUNT { MATCH ()-[:SIMILAR_TO]->() } AS similarityEdges
            """, Mode.READ);

    private CypherStatements() {
    }

    /**
     * Index options cannot be parameterized, so name and dimension are rendered into the statement.
     */
    public static CypherStatement vectorIndex(String indexName, int dimensions) {
        return new CypherStatement("ensureVectorIndex", String.format("""
                CREATE VECTOR INDEX %s IF NOT EXISTS
                FOR (a:Article) ON (a.embedding)
                OPTIONS {indexConfig: {
                  `vector.dimensions`: %d,
                  `vector.similarity_function`: 'cosine'
                }}
                """, indexName, dimensions), Mode.SCHEMA);
    }
}
