/*
 * どこで: Dispatch サービス層
 * 何を: 現在の状態では許されない遷移を要求されたことを表す
 * なぜ: replay などの運用操作を 409 として返すため
 */
package com.example.dispatch.service;

import com.example.dispatch.model.JobState;
import java.util.UUID;

public class InvalidJobStateException extends RuntimeException {

  public InvalidJobStateException(UUID jobId, JobState actual, JobState expected) {
    super("job state conflict jobId=" + jobId + " actual=" + actual + " expected=" + expected);
  }
}
