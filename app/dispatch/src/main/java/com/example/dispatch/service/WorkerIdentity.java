/*
 * どこで: Dispatch サービス層
 * 何を: lease 所有者として記録するワーカー ID を組み立てる
 * なぜ: どのホストのどのワーカーが lease を保持しているかを DB 上で判別するため
 */
package com.example.dispatch.service;

import com.example.dispatch.config.DispatchWorkerProperties;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WorkerIdentity {

  private static final Logger logger = LoggerFactory.getLogger(WorkerIdentity.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final DispatchWorkerProperties properties;

  public String workerId(int index) {
    return properties.workerIdPrefix() + "-" + resolveHostname() + "-" + index;
  }

  @VisibleForTesting
  String resolveHostname() {
    String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
