/*
 * どこで: Dispatch ドメインモデル
 * 何を: submit の受付結果(ジョブ ID と処理区分)を表現する
 * なぜ: 呼び出し元が後続の状態照会に使う ID を得るため
 */
package com.example.dispatch.model;

import java.util.UUID;

public record SubmissionReceipt(UUID jobId, Disposition disposition, UUID scheduleId, String groupKey) {

  public enum Disposition {
    QUEUED,
    SCHEDULED,
    GROUPED,
    RECURRING,
    SUPPRESSED
  }

  public static SubmissionReceipt queued(UUID jobId) {
    return new SubmissionReceipt(jobId, Disposition.QUEUED, null, null);
  }

  public static SubmissionReceipt scheduled(UUID jobId) {
    return new SubmissionReceipt(jobId, Disposition.SCHEDULED, null, null);
  }

  public static SubmissionReceipt grouped(UUID jobId, String groupKey) {
    return new SubmissionReceipt(jobId, Disposition.GROUPED, null, groupKey);
  }

  public static SubmissionReceipt recurring(UUID scheduleId) {
    return new SubmissionReceipt(null, Disposition.RECURRING, scheduleId, null);
  }

  public static SubmissionReceipt suppressed() {
    return new SubmissionReceipt(null, Disposition.SUPPRESSED, null, null);
  }
}
