/*
 * どこで: Dispatch grouping
 * 何を: 通知種別から grouping 規則を引く
 * なぜ: 設定の Rule を型付きの GroupingRule として受付処理へ渡すため
 */
package com.example.dispatch.service.grouping;

import com.example.dispatch.config.GroupingProperties;
import com.example.dispatch.model.AggregationStrategy;
import com.example.dispatch.model.GroupingRule;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class GroupingRuleRegistry {

  private final GroupingProperties properties;

  /** grouping 無効時、または種別に規則が無い場合は空。 */
  public Optional<GroupingRule> ruleFor(String type) {
    if (!properties.enabled() || type == null) {
      return Optional.empty();
    }
    final GroupingProperties.Rule rule = properties.rules().get(type);
    if (rule == null) {
      return Optional.empty();
    }
    final AggregationStrategy strategy =
        rule.strategy() == null ? AggregationStrategy.COUNT : rule.strategy();
    return Optional.of(
        new GroupingRule(type, rule.window(), rule.dimension(), strategy, rule.maxItems()));
  }
}
