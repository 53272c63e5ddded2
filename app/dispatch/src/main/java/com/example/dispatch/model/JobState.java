/*
 * どこで: Dispatch ドメインモデル
 * 何を: 配信ジョブの状態を定義する
 * なぜ: DB の state 列と遷移規則を型で扱うため
 */
package com.example.dispatch.model;

public enum JobState {
  /** grouping 窓に保留中。digest の flush を待つ。 */
  PENDING,
  /** not_before が未来の状態。到来後は QUEUED と同じく lease 対象。 */
  SCHEDULED,
  QUEUED,
  LEASED,
  DELIVERING,
  SUCCEEDED,
  /** grouping 窓の cancel により配信されずに終わった保留メンバー。 */
  FAILED,
  DEAD;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == DEAD;
  }
}
