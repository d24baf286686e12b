package com.purchasingpower.newsgraph.model;

import java.time.LocalDate;

/**
 * Row of the entity-filtered feed.
 */
public record EntityArticle(String title, String url, LocalDate day) {
}
