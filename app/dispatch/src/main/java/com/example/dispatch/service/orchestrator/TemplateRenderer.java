/*
 * どこで: Dispatch 受付層
 * 何を: テンプレート ID と変数からタイトル/本文を組み立てる処理を抽象化する
 * なぜ: テンプレートの保管先を受付処理から切り離すため
 */
package com.example.dispatch.service.orchestrator;

import java.util.Map;

public interface TemplateRenderer {

  /**
   * @throws com.example.dispatch.service.TemplateNotFoundException テンプレートが無い場合
   */
  RenderedTemplate render(String templateId, Map<String, Object> variables);

  record RenderedTemplate(String title, String body) {}
}
