package com.purchasingpower.newsgraph.pipeline;

import com.purchasingpower.newsgraph.graph.BackendType;
import com.purchasingpower.newsgraph.model.DigestEntry;
import com.purchasingpower.newsgraph.model.EntityArticle;
import com.purchasingpower.newsgraph.model.ProjectArticle;
import com.purchasingpower.newsgraph.model.SimilarMatch;
import com.purchasingpower.newsgraph.model.TopicArticle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Report rendering")
class ReportRendererTest {

    private static final LocalDate DAY = LocalDate.of(2025, 9, 30);

    @Test
    @DisplayName("Should list duplicates and failures of an ingestion")
    void rendersIngestion() {
        // Given
        IngestionReport report = new IngestionReport(BackendType.IN_MEMORY, "Stub", List.of(
                IngestionOutcome.ingested("1719", "WAN 2.5 preview", List.of()),
                IngestionOutcome.ingested("1720", "WAN 2.5 release",
                        List.of(new SimilarMatch("1719", "WAN 2.5 preview", null, 0.9431))),
                IngestionOutcome.failed("1721", "Broken", "Embedding unavailable: timeout")), 12);

        // When
        String text = ReportRenderer.render(report);

        // Then
        assertThat(text)
                .contains("Ingested 2 of 3 article(s) into IN_MEMORY using Stub embeddings")
                .contains("- Potential duplicates for WAN 2.5 release:")
                .contains("WAN 2.5 preview (score=0.943) → (no link)")
                .contains("- FAILED 1721: Embedding unavailable: timeout")
                .doesNotContain("Potential duplicates for WAN 2.5 preview");
    }

    @Test
    @DisplayName("Should group the digest by day and print every section")
    void rendersCatalog() {
        // Given
        QueryCatalogReport report = QueryCatalogReport.builder()
                .digestDays(7)
                .digest(List.of(
                        new DigestEntry(DAY, "OpenAI ships Sora safety bundle", "https://t.me/content_lab/1001",
                                List.of("Generative Video", "OpenAI")),
                        new DigestEntry(DAY, "Untagged post", null, List.of())))
                .entityName("OpenAI")
                .entityDays(14)
                .entityArticles(List.of(new EntityArticle("OpenAI partners with NewsDeck",
                        "https://t.me/content_lab/1004", DAY.minusDays(3))))
                .projectTopic("Vision-Language Models")
                .projects(List.of(new ProjectArticle("Vision Relay", "LensForge toolkit",
                        "https://t.me/content_lab/1002", DAY.minusDays(1))))
                .topicMarker("Image Edit")
                .topicArticles(List.of(new TopicArticle("Image editing model roundup",
                        "https://t.me/content_lab/1003", DAY.minusDays(2), List.of("Image Editing Models"))))
                .build();

        // When
        String text = ReportRenderer.render(report);

        // Then
        assertThat(text)
                .contains("Weekly digest (last 7 days):")
                .contains("  2025-09-30:")
                .contains("OpenAI ships Sora safety bundle [Generative Video, OpenAI] → https://t.me/content_lab/1001")
                .contains("Untagged post [No topic tags] → (no link)")
                .contains("Recent OpenAI news (last 14 days):")
                .contains("2025-09-27: OpenAI partners with NewsDeck")
                .contains("Projects about Vision-Language Models:")
                .contains("2025-09-29: Vision Relay via LensForge toolkit")
                .contains("Topics matching 'Image Edit':")
                .contains("Image editing model roundup [Image Editing Models]");
    }

    @Test
    @DisplayName("Should mark empty sections")
    void emptySections() {
        QueryCatalogReport report = QueryCatalogReport.builder()
                .digestDays(7).digest(List.of())
                .entityName("OpenAI").entityDays(14).entityArticles(List.of())
                .projectTopic("Vision-Language Models").projects(List.of())
                .topicMarker("Image Edit").topicArticles(List.of())
                .build();

        String text = ReportRenderer.render(report);

        assertThat(text.split("\\(none\\)", -1)).hasSize(5);
    }
}
