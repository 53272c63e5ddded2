/*
 * どこで: Dispatch 受付層
 * 何を: 設定済みテンプレートの {{name}} を変数で置換する
 * なぜ: 文面の変更を呼び出し元の改修なしに行えるようにするため
 */
package com.example.dispatch.service.orchestrator;

import com.example.dispatch.config.TemplateProperties;
import com.example.dispatch.service.TemplateNotFoundException;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PlaceholderTemplateRenderer implements TemplateRenderer {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

  private final TemplateProperties properties;

  @Override
  public RenderedTemplate render(String templateId, Map<String, Object> variables) {
    final TemplateProperties.Template template = properties.templates().get(templateId);
    if (template == null) {
      throw new TemplateNotFoundException(templateId);
    }
    return new RenderedTemplate(
        substitute(template.title(), variables), substitute(template.body(), variables));
  }

  /** 未定義の変数は空文字に置き換える。 */
  String substitute(String text, Map<String, Object> variables) {
    if (text == null) {
      return null;
    }
    final Matcher matcher = PLACEHOLDER.matcher(text);
    final StringBuilder rendered = new StringBuilder();
    while (matcher.find()) {
      final Object value = variables.get(matcher.group(1));
      matcher.appendReplacement(rendered, Matcher.quoteReplacement(value == null ? "" : value.toString()));
    }
    matcher.appendTail(rendered);
    return rendered.toString();
  }
}
