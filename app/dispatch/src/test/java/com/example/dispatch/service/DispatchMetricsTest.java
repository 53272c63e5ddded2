/*
 * どこで: Dispatch メトリクステスト
 * 何を: 配信結果/E2E遅延/backlog/DLQ/lease 回収メトリクスが記録されることを検証する
 * なぜ: 配信 SLO 指標の計測回帰を防ぐため
 */
package com.example.dispatch.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DispatchMetricsTest {

  @Test
  void recordsDeliveryAndBacklogMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final DispatchMetrics metrics = new DispatchMetrics(registry);

    final Instant createdAt = Instant.parse("2026-02-24T00:00:00Z");
    final Instant deliveredAt = Instant.parse("2026-02-24T00:00:10Z");

    metrics.recordDeliveryResult("succeeded");
    metrics.recordDeliveryResult("succeeded");
    metrics.recordDeliveryResult("retry");
    metrics.recordDeliveryE2eDelay(createdAt, deliveredAt);
    metrics.recordDlqMoved();
    metrics.recordLeasesReaped(3);
    metrics.updateBacklogCurrent(5);

    final Counter succeeded =
        registry.get(DispatchMetrics.METRIC_DELIVERY_TOTAL).tag("result", "succeeded").counter();
    final Counter retry =
        registry.get(DispatchMetrics.METRIC_DELIVERY_TOTAL).tag("result", "retry").counter();
    final Timer e2e = registry.get(DispatchMetrics.METRIC_DELIVERY_E2E_DELAY).timer();
    final Counter dlq = registry.get(DispatchMetrics.METRIC_DLQ_TOTAL).counter();
    final Counter reaped = registry.get(DispatchMetrics.METRIC_LEASE_REAPED_TOTAL).counter();
    final Gauge backlog = registry.get(DispatchMetrics.METRIC_BACKLOG_CURRENT).gauge();

    assertThat(succeeded.count()).isEqualTo(2.0d);
    assertThat(retry.count()).isEqualTo(1.0d);
    assertThat(e2e.count()).isEqualTo(1L);
    assertThat(dlq.count()).isEqualTo(1.0d);
    assertThat(reaped.count()).isEqualTo(3.0d);
    assertThat(backlog.value()).isEqualTo(5.0d);
  }

  @Test
  void ignoresNegativeE2eDelay() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final DispatchMetrics metrics = new DispatchMetrics(registry);

    // 時計ずれで配信時刻が作成時刻より前になった場合は記録しない
    metrics.recordDeliveryE2eDelay(
        Instant.parse("2026-02-24T00:00:10Z"), Instant.parse("2026-02-24T00:00:00Z"));

    assertThat(registry.get(DispatchMetrics.METRIC_DELIVERY_E2E_DELAY).timer().count()).isZero();
  }
}
