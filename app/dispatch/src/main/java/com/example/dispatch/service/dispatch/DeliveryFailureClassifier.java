/*
 * どこで: Dispatch 配信層
 * 何を: アダプタの配信結果を retry/dead の ack 種別へ分類する
 * なぜ: 宛先不正や認証設定ミスのように再試行しても直らない失敗で試行回数を浪費しないため
 */
package com.example.dispatch.service.dispatch;

import com.example.dispatch.model.AckOutcome;
import com.example.dispatch.model.DeliveryResult;
import com.example.dispatch.model.DeliveryStatus;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class DeliveryFailureClassifier {

  static final Set<String> PERMANENT_CODES =
      Set.of("INVALID_RECIPIENT", "UNSUBSCRIBED", "BLOCKED", "BOUNCED");
  static final Set<String> CONFIGURATION_CODES =
      Set.of("AUTH_FAILED", "INVALID_CREDENTIALS", "CONFIGURATION");

  public record Classification(AckOutcome outcome, String reason) {}

  public Classification classify(DeliveryResult result, String channel) {
    if (result.isSuccess()) {
      return new Classification(AckOutcome.SUCCESS, null);
    }
    final String code =
        result.errorCode() == null ? "" : result.errorCode().trim().toUpperCase(Locale.ROOT);
    if (PERMANENT_CODES.contains(code)) {
      return new Classification(AckOutcome.DEAD, describe("permanent failure", channel, code, result));
    }
    if (CONFIGURATION_CODES.contains(code)) {
      return new Classification(AckOutcome.DEAD, describe("configuration failure", channel, code, result));
    }
    if (result.status() == DeliveryStatus.PERMANENT_ERROR) {
      return new Classification(AckOutcome.DEAD, describe("permanent failure", channel, code, result));
    }
    return new Classification(AckOutcome.RETRY, describe("retryable failure", channel, code, result));
  }

  public Classification missingAdapter(String channel) {
    return new Classification(
        AckOutcome.DEAD, "configuration failure channel=" + channel + " code=NO_ADAPTER");
  }

  private String describe(String kind, String channel, String code, DeliveryResult result) {
    final StringBuilder reason = new StringBuilder(kind).append(" channel=").append(channel);
    if (!code.isEmpty()) {
      reason.append(" code=").append(code);
    }
    if (result.message() != null && !result.message().isBlank()) {
      reason.append(" message=").append(result.message());
    }
    return reason.toString();
  }
}
