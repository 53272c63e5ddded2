/*
 * どこで: Dispatch ドメインモデル
 * 何を: grouping 窓を digest にまとめる際の文面戦略を定義する
 * なぜ: 通知種別ごとに要約の粒度を切り替えるため
 */
package com.example.dispatch.model;

public enum AggregationStrategy {
  COUNT,
  LIST,
  SUMMARY,
  DIGEST
}
