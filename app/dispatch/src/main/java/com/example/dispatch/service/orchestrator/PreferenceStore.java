/*
 * どこで: Dispatch 受付層
 * 何を: ユーザの配信設定(オプトアウト)の参照を抽象化する
 * なぜ: 設定の保管先を受付処理から切り離すため
 */
package com.example.dispatch.service.orchestrator;

public interface PreferenceStore {

  boolean shouldSend(String userId, String type, String channel);
}
