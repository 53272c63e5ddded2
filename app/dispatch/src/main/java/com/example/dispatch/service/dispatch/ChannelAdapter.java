/*
 * どこで: Dispatch 配信層
 * 何を: チャネル(email/sms/push など)への送信を抽象化するインターフェース
 * なぜ: プロバイダ実装の差し替えとテスト用の障害注入を容易にするため
 */
package com.example.dispatch.service.dispatch;

import com.example.dispatch.model.DeliveryResult;
import com.example.dispatch.model.NotificationPayload;
import java.util.Set;

public interface ChannelAdapter {

  /** このアダプタが受け持つチャネル名。 */
  Set<String> channels();

  /**
   * 1 チャネル分を送信する。
   *
   * <p>失敗はエラーコード付きの {@link DeliveryResult} で返す。例外は再試行可能な失敗として扱われる。
   */
  DeliveryResult deliver(NotificationPayload payload, String channel);
}
