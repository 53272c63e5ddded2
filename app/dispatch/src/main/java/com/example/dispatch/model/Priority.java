/*
 * どこで: Dispatch ドメインモデル
 * 何を: 通知の優先度と並び順の rank を定義する
 * なぜ: lease 順序と digest の優先度決定を同じ基準で扱うため
 */
package com.example.dispatch.model;

public enum Priority {
  CRITICAL(4),
  HIGH(3),
  MEDIUM(2),
  LOW(1);

  private final int rank;

  Priority(int rank) {
    this.rank = rank;
  }

  public int rank() {
    return rank;
  }

  public static Priority max(Priority left, Priority right) {
    if (left == null) {
      return right;
    }
    if (right == null) {
      return left;
    }
    return left.rank >= right.rank ? left : right;
  }
}
