package com.purchasingpower.newsgraph.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A single ingested post, keyed by the upstream message id.
 *
 * <p>Topics may contain duplicates; the store merges them by name.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Article {

    @NonNull
    String messageId;

    @NonNull
    String title;

    @NonNull
    String body;

    String url;

    @NonNull
    Instant publishedAt;

    String sourceChannel;

    @Singular
    List<String> topics;

    @Singular
    List<EntityRef> entities;

    @Singular
    List<ProjectRef> projects;

    /**
     * Text handed to the embedding provider.
     */
    public String embeddingInput() {
        return title + "\n\n" + body.strip();
    }
}
