package com.purchasingpower.newsgraph.pipeline;

import com.purchasingpower.newsgraph.model.DigestEntry;
import com.purchasingpower.newsgraph.model.EntityArticle;
import com.purchasingpower.newsgraph.model.ProjectArticle;
import com.purchasingpower.newsgraph.model.TopicArticle;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Results of the four catalog queries together with the parameters they ran with.
 *
 * <p>The parameters come from {@code newsgraph.pipeline}; keeping them next to the rows lets
 * {@link ReportRenderer} print headings such as "Articles mentioning OpenAI in the last 14 days"
 * without reading configuration.
 */
@Value
@Builder
public class QueryCatalogReport {

    int digestDays;
    List<DigestEntry> digest;

    String entityName;
    int entityDays;
    List<EntityArticle> entityArticles;

    String projectTopic;
    List<ProjectArticle> projects;

    String topicMarker;
    List<TopicArticle> topicArticles;
}
