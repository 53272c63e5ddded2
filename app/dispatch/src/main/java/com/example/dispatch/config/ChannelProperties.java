/*
 * どこで: Dispatch アプリの設定バインド
 * 何を: ローカル(ログ出力)アダプタが受け持つチャネルと障害注入設定を保持する
 * なぜ: 実プロバイダ未接続の環境でも配信経路を通しで動かすため
 */
package com.example.dispatch.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dispatch.channels")
public record ChannelProperties(List<String> local, FailureInjection failureInjection) {

  public ChannelProperties {
    local = local == null ? List.of() : List.copyOf(local);
    failureInjection = failureInjection == null ? new FailureInjection(false, "") : failureInjection;
  }

  public record FailureInjection(boolean enabled, String userIdPrefix) {}
}
