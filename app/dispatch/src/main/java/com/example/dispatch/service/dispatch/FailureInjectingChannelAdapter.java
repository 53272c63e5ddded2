/*
 * どこで: Dispatch 配信層
 * 何を: CI/Test 専用で送信失敗を注入するチャネルアダプタ
 * なぜ: 実コード経路を汚さずに E2E で retry -> dead-letter を再現するため
 */
package com.example.dispatch.service.dispatch;

import com.example.dispatch.config.ChannelProperties;
import com.example.dispatch.model.DeliveryResult;
import com.example.dispatch.model.NotificationPayload;
import java.util.Set;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Profile;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "dispatch.channels.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingChannelAdapter implements ChannelAdapter {

  private final LocalChannelAdapter delegate;
  private final String recipientPrefix;

  public FailureInjectingChannelAdapter(LocalChannelAdapter delegate, ChannelProperties properties) {
    this.delegate = delegate;
    this.recipientPrefix = properties.failureInjection().userIdPrefix();
  }

  @Override
  public Set<String> channels() {
    return delegate.channels();
  }

  @Override
  public DeliveryResult deliver(NotificationPayload payload, String channel) {
    if (shouldInjectFailure(payload.recipient())) {
      throw new IllegalStateException(
          "notification delivery failure injection matched recipient=" + payload.recipient());
    }
    return delegate.deliver(payload, channel);
  }

  private boolean shouldInjectFailure(String recipient) {
    if (recipientPrefix == null || recipientPrefix.isBlank() || recipient == null) {
      return false;
    }
    return recipient.startsWith(recipientPrefix);
  }
}
