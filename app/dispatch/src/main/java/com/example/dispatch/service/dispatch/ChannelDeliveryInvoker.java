/*
 * どこで: Dispatch 配信層
 * 何を: チャネルアダプタ呼び出しを専用スレッドで実行し、配信タイムアウトを課す
 * なぜ: 応答しないプロバイダが lease 期限を越えてワーカーを占有しないようにするため
 */
package com.example.dispatch.service.dispatch;

import com.example.dispatch.config.DispatchWorkerProperties;
import com.example.dispatch.model.DeliveryResult;
import com.example.dispatch.model.NotificationPayload;
import com.example.dispatch.service.DispatchMetrics;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

@Component
public class ChannelDeliveryInvoker implements DisposableBean {

  private static final Logger logger = LoggerFactory.getLogger(ChannelDeliveryInvoker.class);

  private static final int POOL_SLOTS_PER_WORKER = 2;

  private final DispatchWorkerProperties properties;
  private final DispatchMetrics metrics;
  private final ThreadPoolExecutor executor;

  public ChannelDeliveryInvoker(DispatchWorkerProperties properties, DispatchMetrics metrics) {
    this.properties = properties;
    this.metrics = metrics;
    // ワーカー 1 本あたり同時 1 配信。割り込みを無視して戻らないスレッドの分だけ余裕を持たせる
    final int poolSize = Math.max(1, properties.workerCount()) * POOL_SLOTS_PER_WORKER;
    final ThreadPoolExecutor pool =
        new ThreadPoolExecutor(
            poolSize,
            poolSize,
            60L,
            TimeUnit.SECONDS,
            new SynchronousQueue<>(),
            new ThreadFactoryBuilder().setNameFormat("dispatch-delivery-%d").setDaemon(true).build());
    pool.allowCoreThreadTimeOut(true);
    this.executor = pool;
  }

  @VisibleForTesting
  int poolSize() {
    return executor.getMaximumPoolSize();
  }

  /**
   * アダプタを配信タイムアウト付きで呼び出す。
   *
   * <p>タイムアウト、アダプタの例外、配信スレッドの枯渇はすべて再試行可能な結果として返す。
   */
  public DeliveryResult invoke(ChannelAdapter adapter, NotificationPayload payload, String channel) {
    final Future<DeliveryResult> future;
    try {
      future = executor.submit(() -> adapter.deliver(payload, channel));
    } catch (RejectedExecutionException ex) {
      metrics.recordDeliveryResult("saturated");
      logger.warn("channel delivery rejected channel={} poolSize={}", channel, poolSize());
      return DeliveryResult.retryable("SATURATED", "delivery threads exhausted");
    }
    try {
      final DeliveryResult result =
          future.get(properties.deliveryTimeout().toMillis(), TimeUnit.MILLISECONDS);
      return result == null ? DeliveryResult.retryable("EMPTY_RESULT", "adapter returned no result") : result;
    } catch (TimeoutException ex) {
      future.cancel(true);
      metrics.recordDeliveryResult("timeout");
      logger.warn("channel delivery timed out channel={} timeoutMs={}", channel, properties.deliveryTimeout().toMillis());
      return DeliveryResult.retryable("TIMEOUT", "delivery timed out after " + properties.deliveryTimeout());
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      logger.warn("channel adapter failed channel={}", channel, cause);
      return DeliveryResult.retryable("ADAPTER_ERROR", cause.getMessage());
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      return DeliveryResult.retryable("INTERRUPTED", "delivery interrupted");
    }
  }

  @Override
  public void destroy() {
    executor.shutdownNow();
  }
}
