package com.example.dispatch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

import com.example.dispatch.config.DispatchWorkerProperties;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class WorkerIdentityTest {

  @Test
  void workerIdCombinesPrefixHostnameAndIndex() {
    final WorkerIdentity identity =
        spy(
            new WorkerIdentity(
                new DispatchWorkerProperties(
                    true,
                    2,
                    10,
                    Duration.ofSeconds(10),
                    Duration.ofSeconds(1),
                    Duration.ofMillis(200),
                    Duration.ofSeconds(5),
                    "dispatch")));
    doReturn("host-a").when(identity).resolveHostname();

    assertThat(identity.workerId(0)).isEqualTo("dispatch-host-a-0");
    assertThat(identity.workerId(1)).isEqualTo("dispatch-host-a-1");
  }

  @Test
  void resolveHostnameNeverReturnsBlank() {
    final WorkerIdentity identity =
        new WorkerIdentity(
            new DispatchWorkerProperties(
                true,
                1,
                10,
                Duration.ofSeconds(10),
                Duration.ofSeconds(1),
                Duration.ofMillis(200),
                Duration.ofSeconds(5),
                "dispatch"));

    assertThat(identity.resolveHostname()).isNotBlank();
  }
}
