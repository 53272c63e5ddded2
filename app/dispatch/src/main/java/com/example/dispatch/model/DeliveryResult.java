/*
 * どこで: Dispatch ドメインモデル
 * 何を: チャネルアダプタ 1 回分の配信結果を表現する
 * なぜ: エラーコードから retry/dead を分類するため
 */
package com.example.dispatch.model;

public record DeliveryResult(DeliveryStatus status, String errorCode, String message) {

  private static final DeliveryResult SUCCESS = new DeliveryResult(DeliveryStatus.SUCCESS, null, null);

  public static DeliveryResult success() {
    return SUCCESS;
  }

  public static DeliveryResult retryable(String errorCode, String message) {
    return new DeliveryResult(DeliveryStatus.RETRYABLE_ERROR, errorCode, message);
  }

  public static DeliveryResult permanent(String errorCode, String message) {
    return new DeliveryResult(DeliveryStatus.PERMANENT_ERROR, errorCode, message);
  }

  public boolean isSuccess() {
    return status == DeliveryStatus.SUCCESS;
  }
}
