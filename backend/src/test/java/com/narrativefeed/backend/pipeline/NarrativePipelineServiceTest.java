package com.narrativefeed.backend.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.narrativefeed.backend.content.ContentItemRepository;
import com.narrativefeed.backend.content.dto.ContentItemDTO;
import com.narrativefeed.backend.extraction.ItemEntityRepository;
import com.narrativefeed.backend.narratives.dto.MetricSnapshotDto;
import com.narrativefeed.backend.narratives.dto.NarrativeDisplayDto;
import com.narrativefeed.backend.narratives.entity.MetricPeriod;
import com.narrativefeed.backend.narratives.entity.Narrative;
import com.narrativefeed.backend.narratives.repository.NarrativeLinkRepository;
import com.narrativefeed.backend.narratives.repository.NarrativeMetricRepository;
import com.narrativefeed.backend.narratives.repository.NarrativeRepository;
import com.narrativefeed.backend.narratives.service.NarrativeMetricsService;
import com.narrativefeed.backend.narratives.service.NarrativeQueryService;
import com.narrativefeed.backend.narratives.service.NarrativeSentimentService;
import com.narrativefeed.backend.pipeline.dto.PipelineRunResult;
import com.narrativefeed.backend.sentiment.Sentiment;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@SpringBootTest
class NarrativePipelineServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @TestConfiguration
    static class FixedClock {
        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    NarrativePipelineService pipelineService;

    @Autowired
    NarrativeSentimentService sentimentService;

    @Autowired
    NarrativeMetricsService metricsService;

    @Autowired
    NarrativeQueryService queryService;

    @Autowired
    NarrativeRepository narrativeRepository;

    @Autowired
    NarrativeLinkRepository linkRepository;

    @Autowired
    NarrativeMetricRepository metricRepository;

    @Autowired
    ContentItemRepository contentItemRepository;

    @Autowired
    ItemEntityRepository itemEntityRepository;

    @BeforeEach
    void cleanDatabase() {
        metricRepository.deleteAll();
        linkRepository.deleteAll();
        narrativeRepository.deleteAll();
        itemEntityRepository.deleteAll();
        contentItemRepository.deleteAll();
    }

    private static ContentItemDTO item(String id, String title, String body, String publishedAt) {
        return ContentItemDTO.builder()
                .id(id)
                .title(title)
                .body(body)
                .publishedAt(publishedAt)
                .sourceKind("article")
                .sourceName("wire")
                .build();
    }

    private static List<ContentItemDTO> batch() {
        return List.of(
                item("tsla-1", "$TSLA shares plunged as Elon Musk faced investor concerns",
                        "the stock fell after weak delivery numbers", "2026-03-10T10:00:00Z"),
                item("tsla-2", "$TSLA tumbles after Elon Musk warns of slowdown",
                        "analysts see losses ahead", "2026-03-10T09:00:00Z"),
                item("tsla-3", "Elon Musk comments sink $TSLA",
                        "the selloff deepened on recession fears", "2026-03-10T07:00:00Z"),
                item("aapl-1", "$AAPL unveils new devices",
                        "reviewers praised the battery life", "2026-03-10T11:00:00Z"),
                item("bank-1", "Central Bank holds rates",
                        "policy unchanged this month", "2026-03-10T08:00:00Z"));
    }

    @Test
    @DisplayName("five items with three about $TSLA and Elon Musk yield one bearish narrative")
    void endToEnd() {
        PipelineRunResult result = pipelineService.ingestAndProcess(batch());

        assertThat(result.getIngestion().getSucceededCount()).isEqualTo(5);
        assertThat(result.getExtraction().getSucceededCount()).isEqualTo(5);
        assertThat(result.getExtraction().hasFailures()).isFalse();
        assertThat(result.isDetectionSkipped()).isFalse();
        assertThat(result.getCandidatesDetected()).isEqualTo(1);
        assertThat(result.getNarrativesCreated()).isEqualTo(1);
        assertThat(result.getSentiment().getSucceededCount()).isEqualTo(1);

        List<Narrative> narratives = narrativeRepository.findAll();
        assertThat(narratives).hasSize(1);
        Narrative narrative = narratives.get(0);
        assertThat(narrative.getTitle()).isEqualTo("$TSLA Market Movement");
        assertThat(narrative.getSummary()).isEqualTo("3 items discussing $TSLA, Elon Musk over the last 3 hours");
        assertThat(narrative.getEffectiveSentiment()).isEqualTo(Sentiment.BEARISH);
        assertThat(linkRepository.findItemIdsByNarrativeId(narrative.getId()))
                .containsExactly("tsla-1", "tsla-2", "tsla-3");

        Map<String, MetricSnapshotDto> latest = metricsService.getLatestMetrics(narrative.getId());
        assertThat(latest.get("24h").getMentionCount()).isEqualTo(3);
        assertThat(latest.get("24h").getVelocity()).isEqualTo(100.0);
        // tsla-1 sits exactly two hours back, at the start of the previous short window
        assertThat(latest.get("1h").getMentionCount()).isZero();
        assertThat(latest.get("1h").getVelocity()).isEqualTo(-100.0);
    }

    @Test
    @DisplayName("an overlong token or provider label does not knock an item out of detection")
    void overlongInputStillClusters() {
        ContentItemDTO longToken = item("nvda-1", "$NVDA rallies as Jensen Huang unveils chips",
                "order book " + "z".repeat(300), "2026-03-10T11:00:00Z");
        ContentItemDTO longLabel = item("nvda-2", "Jensen Huang lifts $NVDA outlook",
                "guidance raised", "2026-03-10T10:30:00Z");
        longLabel.setSourceName("Consolidated Semiconductor Industry Newsletter ".repeat(3).trim());
        ContentItemDTO plain = item("nvda-3", "$NVDA gains as Jensen Huang touts demand",
                "datacenter orders", "2026-03-10T08:00:00Z");

        PipelineRunResult result = pipelineService.ingestAndProcess(List.of(longToken, longLabel, plain));

        assertThat(result.getIngestion().getFailed()).isEmpty();
        assertThat(result.getExtraction().getFailed()).isEmpty();
        assertThat(result.getCandidatesDetected()).isEqualTo(1);
        assertThat(narrativeRepository.findAll()).extracting(Narrative::getTitle)
                .containsExactly("$NVDA Market Movement");
        assertThat(contentItemRepository.findById("nvda-2")).get()
                .extracting(stored -> stored.getSourceName().length())
                .isEqualTo(longLabel.getSourceName().length());
    }

    @Test
    @DisplayName("rebuilding over unchanged content adds nothing")
    void rebuildIsStable() {
        pipelineService.ingestAndProcess(batch());
        Long narrativeId = narrativeRepository.findAll().get(0).getId();

        PipelineRunResult rebuild = pipelineService.rebuild();

        assertThat(rebuild.getCandidatesDetected()).isEqualTo(1);
        assertThat(rebuild.getNarrativesCreated()).isZero();
        assertThat(rebuild.getNarrativesExtended()).isZero();
        assertThat(rebuild.getChangedNarrativeIds()).isEmpty();
        assertThat(narrativeRepository.count()).isEqualTo(1);
        assertThat(linkRepository.countByNarrativeId(narrativeId)).isEqualTo(3);
        // one new metric row per period per run
        assertThat(metricRepository.countByNarrativeId(narrativeId)).isEqualTo(4);
    }

    @Test
    @DisplayName("a later item about the same story extends the narrative")
    void laterItemExtends() {
        pipelineService.ingestAndProcess(batch());

        PipelineRunResult second = pipelineService.ingestAndProcess(List.of(
                item("tsla-4", "$TSLA slides again as Elon Musk sells", "another drop in early trading",
                        "2026-03-10T11:30:00Z")));

        assertThat(second.getNarrativesCreated()).isZero();
        assertThat(second.getNarrativesExtended()).isEqualTo(1);
        Narrative narrative = narrativeRepository.findAll().get(0);
        assertThat(narrative.getSummary()).startsWith("4 items discussing");
        assertThat(linkRepository.countByNarrativeId(narrative.getId())).isEqualTo(4);
    }

    @Test
    @DisplayName("a manual override wins until cleared and survives recomputation")
    void sentimentOverride() {
        pipelineService.ingestAndProcess(batch());
        Long narrativeId = narrativeRepository.findAll().get(0).getId();

        sentimentService.setOverride(narrativeId, Sentiment.BULLISH);
        sentimentService.recompute(narrativeId);
        Narrative overridden = narrativeRepository.findById(narrativeId).orElseThrow();
        assertThat(overridden.getEffectiveSentiment()).isEqualTo(Sentiment.BULLISH);
        assertThat(overridden.getSentiment()).isEqualTo(Sentiment.BEARISH);

        sentimentService.setOverride(narrativeId, null);
        assertThat(narrativeRepository.findById(narrativeId).orElseThrow().getEffectiveSentiment())
                .isEqualTo(Sentiment.BEARISH);
    }

    @Test
    @DisplayName("the detail view lists linked items newest first with the latest metrics")
    void detailView() {
        pipelineService.ingestAndProcess(batch());
        Long narrativeId = narrativeRepository.findAll().get(0).getId();

        NarrativeDisplayDto detail = queryService.get(narrativeId);

        assertThat(detail.getItemCount()).isEqualTo(3);
        assertThat(detail.getItems()).extracting("id").containsExactly("tsla-1", "tsla-2", "tsla-3");
        assertThat(detail.getLatestMetrics()).containsKeys("1h", "24h");
        assertThat(metricsService.getTrending(MetricPeriod.LONG, 5))
                .extracting(MetricSnapshotDto::getNarrativeId)
                .containsExactly(narrativeId);
    }
}
