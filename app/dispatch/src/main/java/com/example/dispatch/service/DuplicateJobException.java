/*
 * どこで: Dispatch サービス層
 * 何を: 同一 jobId の enqueue が既存ジョブと衝突したことを表す
 * なぜ: 冪等キーとしての jobId 重複を呼び出し元へ明示的に返すため
 */
package com.example.dispatch.service;

import java.util.UUID;

public class DuplicateJobException extends RuntimeException {

  private final UUID jobId;

  public DuplicateJobException(UUID jobId) {
    super("job already exists jobId=" + jobId);
    this.jobId = jobId;
  }

  public UUID jobId() {
    return jobId;
  }
}
