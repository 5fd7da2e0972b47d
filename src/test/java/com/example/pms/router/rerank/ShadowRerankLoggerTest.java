package com.example.pms.router.rerank;

import com.example.pms.router.model.FkTier;
import com.example.pms.router.model.FocusedEntity;
import com.example.pms.router.model.RecordType;
import com.example.pms.router.model.RelationDomain;
import com.example.pms.router.model.RelationGroup;
import com.example.pms.router.model.RelationItem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@ExtendWith(OutputCaptureExtension.class)
class ShadowRerankLoggerTest {

  private static final String FOCUS_ID = "9f1c2b7a-0d3e-4c55-8a10-2f5e6d7c8b9a";
  private static final Instant T0 = Instant.parse("2025-02-01T00:00:00Z");

  // served order is FK-only: the newer, unrelated item first
  private final RelationGroup group = new RelationGroup(RelationDomain.WORK_ORDERS, List.of(
      item("wo-aaaaaaaa-1111", T0.plusSeconds(60), new float[]{0f, 1f}),
      item("wo-bbbbbbbb-2222", T0, new float[]{1f, 0f}),
      item("wo-cccccccc-3333", T0.minusSeconds(60), null)));
  private final FocusedEntity focus = new FocusedEntity(RecordType.EQUIPMENT, FOCUS_ID, new float[]{1f, 0f});

  @Test
  void summaryReportsCosineStatsAndRankMovement() {
    ShadowRerankLogger.GroupSummary summary = ShadowRerankLogger.summarize(focus, group, 1.0, 5);

    assertThat(summary.items()).isEqualTo(3);
    assertThat(summary.embedded()).isEqualTo(2);
    assertThat(summary.meanCosine()).isCloseTo(0.5, within(1e-9));
    assertThat(summary.medianCosine()).isCloseTo(0.5, within(1e-9));
    assertThat(summary.stdevCosine()).isCloseTo(0.5, within(1e-9));
    assertThat(summary.deltas()).extracting(ShadowRerankLogger.RankDelta::shadowRank).containsExactly(2, 1, 3);
    assertThat(summary.deltas().get(1).delta()).isEqualTo(1);
  }

  @Test
  void negativeSimilaritiesKeepTheirSignInStatistics() {
    RelationGroup opposed = new RelationGroup(RelationDomain.WORK_ORDERS, List.of(
        item("wo-opposite", T0, new float[]{-1f, 0f}),
        item("wo-mostly-opposite", T0.minusSeconds(60), new float[]{-0.6f, 0.8f})));

    ShadowRerankLogger.GroupSummary summary = ShadowRerankLogger.summarize(focus, opposed, 0.5, 5);

    assertThat(summary.meanCosine()).isCloseTo(-0.8, within(1e-6));
    assertThat(summary.medianCosine()).isCloseTo(-0.8, within(1e-6));
    assertThat(summary.stdevCosine()).isCloseTo(0.2, within(1e-6));
    // no boost below zero, so the served order stands
    assertThat(summary.deltas()).extracting(ShadowRerankLogger.RankDelta::delta).containsOnly(0);
  }

  @Test
  void alphaSimulationLogsOneLinePerAlpha(CapturedOutput output) {
    new ShadowRerankLogger(true, 0.5, 5).logAlphaSimulation(focus, List.of(group), List.of(0.0, 0.1, 0.3));

    assertThat(output.getOut()).contains("alpha=0.0").contains("alpha=0.1").contains("alpha=0.3");
    assertThat(output.getOut()).doesNotContain(FOCUS_ID).doesNotContain("wo-bbbbbbbb-2222");
  }

  @Test
  void simulatedOrderFollowsTheBlendedScore() {
    assertThat(ShadowRerankLogger.simulateOrder(focus, group, 0.0, 5))
        .containsExactly("wo-aaaaa...", "wo-bbbbb...", "wo-ccccc...");
    assertThat(ShadowRerankLogger.simulateOrder(focus, group, 0.3, 2))
        .containsExactly("wo-bbbbb...", "wo-aaaaa...");
  }

  @Test
  void effectivenessCountsItemsThatChangePosition() {
    ShadowRerankLogger.RerankEffectiveness result = ShadowRerankLogger.effectiveness(focus, List.of(group), 0.3);

    assertThat(result.ok()).isTrue();
    assertThat(result.totalItems()).isEqualTo(3);
    assertThat(result.embeddedItems()).isEqualTo(2);
    assertThat(result.itemsChangedPosition()).isEqualTo(2);
    assertThat(ShadowRerankLogger.effectiveness(focus, List.of(group), 0.0).itemsChangedPosition()).isZero();
  }

  @Test
  void effectivenessReportsMissingInputs() {
    FocusedEntity noEmbedding = new FocusedEntity(RecordType.EQUIPMENT, FOCUS_ID, null);

    assertThat(ShadowRerankLogger.effectiveness(noEmbedding, List.of(group), 0.3).error())
        .isEqualTo(ShadowRerankLogger.RerankEffectiveness.NO_FOCUSED_EMBEDDING);
    assertThat(ShadowRerankLogger.effectiveness(focus, List.of(), 0.3).error())
        .isEqualTo(ShadowRerankLogger.RerankEffectiveness.NO_ITEMS);
    assertThat(ShadowRerankLogger.effectiveness(focus, List.of(RelationGroup.empty(RelationDomain.FAULTS)), 0.3).error())
        .isEqualTo(ShadowRerankLogger.RerankEffectiveness.NO_ITEMS);
  }

  @Test
  void topNLimitsReportedDeltas() {
    assertThat(ShadowRerankLogger.summarize(focus, group, 0.5, 1).deltas()).hasSize(1);
  }

  @Test
  void idsAreTruncated() {
    assertThat(ShadowRerankLogger.truncateId(FOCUS_ID)).isEqualTo("9f1c2b7a...");
    assertThat(ShadowRerankLogger.truncateId("short")).isEqualTo("short");
    assertThat(ShadowRerankLogger.truncateId(null)).isEqualTo("-");
  }

  @Test
  void logLinesCarryOnlyTruncatedIds(CapturedOutput output) {
    new ShadowRerankLogger(true, 0.5, 5).log(focus, List.of(group, RelationGroup.empty(RelationDomain.FAULTS)));

    assertThat(output.getOut()).contains("domain=work_orders").contains("9f1c2b7a...");
    assertThat(output.getOut()).doesNotContain(FOCUS_ID).doesNotContain("wo-aaaaaaaa-1111");
    assertThat(output.getOut()).doesNotContain("domain=faults");
  }

  @Test
  void disabledLoggerWritesNothing(CapturedOutput output) {
    new ShadowRerankLogger(false, 0.5, 5).log(focus, List.of(group));

    assertThat(output.getOut()).doesNotContain("shadow focus=");
  }

  private static RelationItem item(String id, Instant at, float[] embedding) {
    return RelationItem.of(RecordType.WORK_ORDER, id, FkTier.DIRECT, 500, at, embedding, false);
  }
}
