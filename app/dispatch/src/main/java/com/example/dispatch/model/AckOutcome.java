/*
 * どこで: Dispatch ドメインモデル
 * 何を: 配信試行の結果としてキューへ返す ack 種別を定義する
 * なぜ: retry/throttle/dead の扱いをキュー側で一元化するため
 */
package com.example.dispatch.model;

public enum AckOutcome {
  SUCCESS,
  RETRY,
  /** rate limit による差し戻し。attempt は消費しない。 */
  THROTTLED,
  DEAD
}
