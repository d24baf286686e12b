package com.purchasingpower.newsgraph.model;

import java.util.List;

/**
 * Project featured by an article.
 *
 * @param name        identity of the project node
 * @param description optional; a blank value never replaces a stored description
 * @param topics      topic names the project is about
 */
public record ProjectRef(String name, String description, List<String> topics) {

    public ProjectRef {
        topics = topics == null ? List.of() : List.copyOf(topics);
        description = description == null || description.isBlank() ? null : description;
    }

    public ProjectRef(String name, List<String> topics) {
        this(name, null, topics);
    }
}
