/*
 * どこで: Dispatch サービス層
 * 何を: 配信結果/E2E遅延/backlog/DLQ/lease回収/grouping/schedule のメトリクスを記録する
 * なぜ: キューの健全性と各コンポーネントの判断結果を Prometheus から観測できるようにするため
 */
package com.example.dispatch.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DispatchMetrics {

  static final String METRIC_DELIVERY_TOTAL = "dispatch.delivery.total";
  static final String METRIC_DELIVERY_E2E_DELAY = "dispatch.delivery.e2e.delay";
  static final String METRIC_BACKLOG_CURRENT = "dispatch.backlog.current";
  static final String METRIC_DLQ_TOTAL = "dispatch.dlq.total";
  static final String METRIC_LEASE_REAPED_TOTAL = "dispatch.lease.reaped.total";
  static final String METRIC_GROUPING_TOTAL = "dispatch.grouping.total";
  static final String METRIC_SCHEDULE_MATERIALIZED_TOTAL = "dispatch.schedule.materialized.total";

  private final MeterRegistry meterRegistry;
  private final AtomicLong backlogCurrent = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> taggedCounters = new ConcurrentHashMap<>();
  private final Counter dlqCounter;
  private final Counter leaseReapedCounter;
  private final Timer deliveryE2eDelayTimer;

  public DispatchMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BACKLOG_CURRENT, backlogCurrent, AtomicLong::get)
        .description("Current number of queued or scheduled jobs")
        .register(meterRegistry);
    this.dlqCounter =
        Counter.builder(METRIC_DLQ_TOTAL)
            .description("Total number of jobs routed to the dead-letter sink")
            .register(meterRegistry);
    this.leaseReapedCounter =
        Counter.builder(METRIC_LEASE_REAPED_TOTAL)
            .description("Total number of expired leases returned to the queue")
            .register(meterRegistry);
    this.deliveryE2eDelayTimer =
        Timer.builder(METRIC_DELIVERY_E2E_DELAY)
            .description("End-to-end delay from job created_at to successful delivery")
            .register(meterRegistry);
  }

  public void recordDeliveryResult(String result) {
    increment(METRIC_DELIVERY_TOTAL, "Dispatch delivery outcomes", result);
  }

  public void recordGroupingResult(String result) {
    increment(METRIC_GROUPING_TOTAL, "Grouping decisions", result);
  }

  public void recordScheduleMaterialized(String result) {
    increment(METRIC_SCHEDULE_MATERIALIZED_TOTAL, "Schedule materialization outcomes", result);
  }

  public void recordDeliveryE2eDelay(Instant createdAt, Instant deliveredAt) {
    if (createdAt == null || deliveredAt == null || deliveredAt.isBefore(createdAt)) {
      return;
    }
    deliveryE2eDelayTimer.record(Duration.between(createdAt, deliveredAt));
  }

  public void recordDlqMoved() {
    dlqCounter.increment();
  }

  public void recordLeasesReaped(int count) {
    if (count > 0) {
      leaseReapedCounter.increment(count);
    }
  }

  public void updateBacklogCurrent(long backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }

  private void increment(String name, String description, String result) {
    taggedCounters
        .computeIfAbsent(
            name + "|" + result,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }
}
