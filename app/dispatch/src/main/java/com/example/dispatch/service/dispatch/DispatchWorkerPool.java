/*
 * どこで: Dispatch 配信ワーカー
 * 何を: 固定数のワーカースレッドで lease -> 配信 -> ack のループを回す
 * なぜ: 配信の並列度を設定で固定し、アプリのライフサイクルに合わせて開始/停止するため
 */
package com.example.dispatch.service.dispatch;

import com.example.dispatch.config.DispatchWorkerProperties;
import com.example.dispatch.service.WorkerIdentity;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "dispatch.worker.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DispatchWorkerPool implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(DispatchWorkerPool.class);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  private final DispatchJobProcessor processor;
  private final WorkerIdentity workerIdentity;
  private final DispatchWorkerProperties properties;

  private volatile boolean running;
  private ExecutorService executor;

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    executor =
        Executors.newFixedThreadPool(
            properties.workerCount(),
            new ThreadFactoryBuilder().setNameFormat("dispatch-worker-%d").build());
    for (int index = 0; index < properties.workerCount(); index++) {
      final String workerId = workerIdentity.workerId(index);
      executor.submit(() -> loop(workerId));
    }
    logger.info("dispatch worker pool started workers={} batchSize={}", properties.workerCount(), properties.batchSize());
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        logger.warn("dispatch worker pool did not terminate within {}s; leases will be reaped", SHUTDOWN_TIMEOUT_SECONDS);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    logger.info("dispatch worker pool stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  private void loop(String workerId) {
    final IdleBackoff idleBackoff = new IdleBackoff(properties.idleBackoffMin(), properties.idleBackoffMax());
    while (running && !Thread.currentThread().isInterrupted()) {
      try {
        if (processor.runOnce(workerId) == 0) {
          sleep(idleBackoff.next());
        } else {
          idleBackoff.reset();
        }
      } catch (RuntimeException ex) {
        logger.error("dispatch worker loop failed workerId={}", workerId, ex);
        sleep(idleBackoff.next());
      }
    }
  }

  private void sleep(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
