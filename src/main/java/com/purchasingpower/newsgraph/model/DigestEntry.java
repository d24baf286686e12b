package com.purchasingpower.newsgraph.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Row of the recent-activity digest.
 */
public record DigestEntry(LocalDate day, String title, String url, List<String> topics) {
}
