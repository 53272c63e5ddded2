/*
 * どこで: Dispatch 配信層
 * 何を: チャネル名から送信アダプタを引く
 * なぜ: 同じチャネルを複数アダプタが名乗る場合に @Order の先頭を採用するため
 */
package com.example.dispatch.service.dispatch;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class ChannelAdapterRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ChannelAdapterRegistry.class);

  private final Map<String, ChannelAdapter> adaptersByChannel = new HashMap<>();

  public ChannelAdapterRegistry(ObjectProvider<ChannelAdapter> adapters) {
    adapters
        .orderedStream()
        .forEach(
            adapter ->
                adapter
                    .channels()
                    .forEach(channel -> adaptersByChannel.putIfAbsent(channel, adapter)));
    logger.info("channel adapters registered channels={}", adaptersByChannel.keySet());
  }

  public Optional<ChannelAdapter> find(String channel) {
    return Optional.ofNullable(adaptersByChannel.get(channel));
  }
}
