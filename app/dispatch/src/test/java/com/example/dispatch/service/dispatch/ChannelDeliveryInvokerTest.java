/*
 * どこで: Dispatch 配信層のユニットテスト
 * 何を: アダプタ呼び出しのタイムアウト、例外の結果変換、配信スレッド枯渇時の拒否を検証する
 * なぜ: 応答しないプロバイダがワーカーを占有しないことを担保するため
 */
package com.example.dispatch.service.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.example.dispatch.DispatchTestJobs;
import com.example.dispatch.config.DispatchWorkerProperties;
import com.example.dispatch.model.DeliveryResult;
import com.example.dispatch.model.DeliveryStatus;
import com.example.dispatch.model.NotificationPayload;
import com.example.dispatch.service.DispatchMetrics;
import com.google.common.util.concurrent.Uninterruptibles;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ChannelDeliveryInvokerTest {

  private static final NotificationPayload PAYLOAD = DispatchTestJobs.payload("u_1", List.of("email"));

  private final DispatchMetrics metrics = mock(DispatchMetrics.class);
  private final ChannelDeliveryInvoker invoker =
      new ChannelDeliveryInvoker(
          new DispatchWorkerProperties(
              false,
              1,
              10,
              Duration.ofMillis(100),
              Duration.ofSeconds(1),
              Duration.ofMillis(200),
              Duration.ofSeconds(5),
              "dispatch"),
          metrics);

  @AfterEach
  void tearDown() {
    invoker.destroy();
  }

  @Test
  void returnsAdapterResult() {
    final DeliveryResult result = invoker.invoke(adapter((payload, channel) -> DeliveryResult.success()), PAYLOAD, "email");

    assertThat(result.isSuccess()).isTrue();
  }

  @Test
  void slowAdapterTimesOutAsRetryable() {
    final DeliveryResult result =
        invoker.invoke(
            adapter(
                (payload, channel) -> {
                  try {
                    Thread.sleep(5_000);
                  } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                  }
                  return DeliveryResult.success();
                }),
            PAYLOAD,
            "email");

    assertThat(result.status()).isEqualTo(DeliveryStatus.RETRYABLE_ERROR);
    assertThat(result.errorCode()).isEqualTo("TIMEOUT");
    verify(metrics).recordDeliveryResult("timeout");
  }

  @Test
  void adapterExceptionBecomesRetryableError() {
    final DeliveryResult result =
        invoker.invoke(
            adapter(
                (payload, channel) -> {
                  throw new IllegalStateException("provider unavailable");
                }),
            PAYLOAD,
            "email");

    assertThat(result.errorCode()).isEqualTo("ADAPTER_ERROR");
    assertThat(result.message()).isEqualTo("provider unavailable");
  }

  @Test
  void poolIsSizedFromWorkerCount() {
    assertThat(invoker.poolSize()).isEqualTo(2);
  }

  @Test
  void adaptersIgnoringInterruptExhaustPoolAndLaterCallsAreRejected() {
    final CountDownLatch release = new CountDownLatch(1);
    final ChannelAdapter hung =
        adapter(
            (payload, channel) -> {
              Uninterruptibles.awaitUninterruptibly(release);
              return DeliveryResult.success();
            });
    try {
      assertThat(invoker.invoke(hung, PAYLOAD, "email").errorCode()).isEqualTo("TIMEOUT");
      assertThat(invoker.invoke(hung, PAYLOAD, "email").errorCode()).isEqualTo("TIMEOUT");

      final DeliveryResult rejected =
          invoker.invoke(adapter((payload, channel) -> DeliveryResult.success()), PAYLOAD, "email");

      assertThat(rejected.status()).isEqualTo(DeliveryStatus.RETRYABLE_ERROR);
      assertThat(rejected.errorCode()).isEqualTo("SATURATED");
      verify(metrics).recordDeliveryResult("saturated");
    } finally {
      release.countDown();
    }
  }

  private static ChannelAdapter adapter(Delivery delivery) {
    return new ChannelAdapter() {
      @Override
      public Set<String> channels() {
        return Set.of("email");
      }

      @Override
      public DeliveryResult deliver(NotificationPayload payload, String channel) {
        return delivery.deliver(payload, channel);
      }
    };
  }

  @FunctionalInterface
  private interface Delivery {
    DeliveryResult deliver(NotificationPayload payload, String channel);
  }
}
