package com.purchasingpower.newsgraph.scenario;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.purchasingpower.newsgraph.model.Article;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a JSON array of articles, e.g.
 * <pre>
 * [{"messageId": "tg-1", "title": "...", "body": "...", "publishedAt": "2025-01-02T10:00:00Z",
 *   "topics": ["OpenAI"], "entities": [{"name": "OpenAI", "type": "Org"}],
 *   "projects": [{"name": "Sora", "description": null, "topics": ["Generative Video"]}]}]
 * </pre>
 */
@Slf4j
public class ArticleBatchReader {

    private static final TypeReference<List<Article>> ARTICLE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ArticleBatchReader() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public ArticleBatchReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Article> read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            List<Article> articles = read(in);
            log.info("Loaded {} article(s) from {}", articles.size(), file);
            return articles;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read articles from " + file, e);
        }
    }

    public List<Article> read(InputStream in) throws IOException {
        List<Article> articles = objectMapper.readValue(in, ARTICLE_LIST);
        return articles == null ? List.of() : articles;
    }
}
