package com.purchasingpower.newsgraph.model;

import java.time.LocalDate;

/**
 * Row of the topic-filtered project feed: a project and one article that features it.
 */
public record ProjectArticle(String project, String title, String url, LocalDate day) {
}
