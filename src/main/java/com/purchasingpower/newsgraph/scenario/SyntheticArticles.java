package com.purchasingpower.newsgraph.scenario;

import com.purchasingpower.newsgraph.model.Article;
import com.purchasingpower.newsgraph.model.EntityRef;
import com.purchasingpower.newsgraph.model.ProjectRef;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Six content_lab posts that exercise every relation and query of the graph.
 *
 * <p>tg-1005 is an editor recap of tg-1001 and should be linked to it as a duplicate. tg-0990 is twelve days
 * old and falls outside the weekly digest.
 */
public final class SyntheticArticles {

    private static final String CHANNEL = "content_lab";

    private SyntheticArticles() {
    }

    public static List<Article> create(Clock clock) {
        Instant now = clock.instant();
        return List.of(
                Article.builder()
                        .messageId("tg-1001")
                        .title("OpenAI ships Sora safety bundle")
                        .body("OpenAI dropped a Sora safety update focused on watermarking, improved classifiers, "
                                + "and new policy guardrails. Editors received internal tooling to review generated "
                                + "clips before they are published and the team highlighted upcoming video filters.")
                        .url("https://t.me/content_lab/1001")
                        .publishedAt(now.minus(Duration.ofDays(1)))
                        .sourceChannel(CHANNEL)
                        .topics(List.of("OpenAI", "Generative Video", "Policy"))
                        .entity(new EntityRef("OpenAI", "Org"))
                        .entity(new EntityRef("Sora", "Project"))
                        .project(new ProjectRef("Sora Safety Belt", "New moderation layer for Sora videos",
                                List.of("Vision-Language Models", "Generative Video")))
                        .build(),
                Article.builder()
                        .messageId("tg-1002")
                        .title("LensForge open-sources its VLM agent toolkit")
                        .body("LensForge unveiled Vision Relay, a toolkit that chains VLMs with retrieval agents. "
                                + "The repo ships with Neo4j adapters, telemetry hooks, and scripted evaluations for "
                                + "enterprise copilots.")
                        .url("https://t.me/content_lab/1002")
                        .publishedAt(now.minus(Duration.ofDays(2)))
                        .sourceChannel(CHANNEL)
                        .topics(List.of("Vision-Language Models", "Developer Tools"))
                        .entity(new EntityRef("LensForge", "Org"))
                        .project(new ProjectRef("Vision Relay", "Open VLM agent stack",
                                List.of("Vision-Language Models", "Agent Tooling")))
                        .build(),
                Article.builder()
                        .messageId("tg-1003")
                        .title("Image editing model roundup")
                        .body("Runway, Ideogram, and Adobe all quietly shipped image editing improvements. Firefly "
                                + "added inpainting that keeps lighting consistent, Ideogram rolled out typography "
                                + "aware edits, and Runway's Gen-2 received a portrait refiner.")
                        .url("https://t.me/content_lab/1003")
                        .publishedAt(now.minus(Duration.ofDays(3)))
                        .sourceChannel(CHANNEL)
                        .topics(List.of("Image Editing Models", "Generative AI"))
                        .entity(new EntityRef("Adobe", "Org"))
                        .entity(new EntityRef("Runway", "Org"))
                        .entity(new EntityRef("Ideogram", "Org"))
                        .build(),
                Article.builder()
                        .messageId("tg-1004")
                        .title("OpenAI partners with NewsDeck")
                        .body("NewsDeck tapped OpenAI to power newsroom copilots that browse archives, propose "
                                + "headlines, and anchor references back to Neo4j topic graphs. The pilot covers "
                                + "investigative teams in NYC and London.")
                        .url("https://t.me/content_lab/1004")
                        .publishedAt(now.minus(Duration.ofDays(4)))
                        .sourceChannel(CHANNEL)
                        .topics(List.of("OpenAI", "News Automation"))
                        .entity(new EntityRef("OpenAI", "Org"))
                        .entity(new EntityRef("NewsDeck", "Org"))
                        .build(),
                Article.builder()
                        .messageId("tg-1005")
                        .title("OpenAI ships Sora safety bundle (editor recap)")
                        .body("Editors circulated a recap of the new Sora safety bundle. It reiterates the "
                                + "watermarking roadmap, classifiers, and pre-publish review loop, almost identical "
                                + "to the launch post but framed for team onboarding.")
                        .url("https://t.me/content_lab/1005")
                        .publishedAt(now.minus(Duration.ofDays(1).plusHours(2)))
                        .sourceChannel(CHANNEL)
                        .topics(List.of("OpenAI", "Generative Video"))
                        .entity(new EntityRef("OpenAI", "Org"))
                        .entity(new EntityRef("Sora", "Project"))
                        .project(new ProjectRef("Sora Safety Belt",
                                List.of("Vision-Language Models", "Generative Video")))
                        .build(),
                Article.builder()
                        .messageId("tg-0990")
                        .title("Meta's multimodal lab notes")
                        .body("Meta Reality Labs described a six-month effort on perception fused transformers. "
                                + "While adjacent to VLM work, it's mostly background context and predates this "
                                + "week's focus.")
                        .url("https://t.me/content_lab/990")
                        .publishedAt(now.minus(Duration.ofDays(12)))
                        .sourceChannel(CHANNEL)
                        .topics(List.of("Vision-Language Models", "Research"))
                        .entity(new EntityRef("Meta", "Org"))
                        .build());
    }
}
