package com.purchasingpower.newsgraph.embedding;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic local embeddings built from token hashes. No network, no model.
 *
 * <p>Every lower-cased word token gets a pseudo-random vector seeded by its SHA-256 hash; the text vector is
 * the mean of its token vectors. Texts sharing most of their words end up with a high cosine similarity,
 * which is all the duplicate detector needs when no real provider is reachable.
 */
@Slf4j
public class HashEmbeddingProvider implements EmbeddingProvider {

    public static final int DEFAULT_DIMENSIONS = 256;

    private static final Pattern TOKEN = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final String EMPTY_TOKEN = "empty";

    private final int dimensions;
    private final Map<String, double[]> tokenCache = new ConcurrentHashMap<>();

    public HashEmbeddingProvider() {
        this(DEFAULT_DIMENSIONS);
    }

    public HashEmbeddingProvider(int dimensions) {
        Preconditions.checkArgument(dimensions > 0, "dimensions must be positive, got %s", dimensions);
        this.dimensions = dimensions;
    }

    @Override
    public List<Double> embed(String text) {
        List<String> tokens = tokenize(text);
        double[] sum = new double[dimensions];
        for (String token : tokens) {
            double[] vector = tokenCache.computeIfAbsent(token, this::tokenVector);
            for (int i = 0; i < dimensions; i++) {
                sum[i] += vector[i];
            }
        }

        List<Double> embedding = new ArrayList<>(dimensions);
        for (double value : sum) {
            embedding.add(value / tokens.size());
        }
        log.debug("Hash embedding built from {} tokens", tokens.size());
        return embedding;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String name() {
        return "hash-" + dimensions;
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text != null) {
            Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
            while (matcher.find()) {
                tokens.add(matcher.group());
            }
        }
        if (tokens.isEmpty()) {
            tokens.add(EMPTY_TOKEN);
        }
        return tokens;
    }

    private double[] tokenVector(String token) {
        long seed = Hashing.sha256().hashString(token, StandardCharsets.UTF_8).asLong();
        Random random = new Random(seed);
        double[] vector = new double[dimensions];
        for (int i = 0; i < dimensions; i++) {
            vector[i] = random.nextDouble() * 2.0 - 1.0;
        }
        return vector;
    }
}
