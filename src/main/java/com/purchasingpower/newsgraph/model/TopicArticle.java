package com.purchasingpower.newsgraph.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Row of the keyword-topic feed, with the matching topic names of the article.
 */
public record TopicArticle(String title, String url, LocalDate day, List<String> topics) {
}
