/*
 * どこで: Dispatch 配信層
 * 何を: 送信を模擬しログに残すだけのチャネルアダプタ
 * なぜ: 外部プロバイダを伴わずに状態遷移を確認するため
 */
package com.example.dispatch.service.dispatch;

import com.example.dispatch.config.ChannelProperties;
import com.example.dispatch.model.DeliveryResult;
import com.example.dispatch.model.NotificationPayload;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalChannelAdapter implements ChannelAdapter {

    private static final Logger logger = LoggerFactory.getLogger(LocalChannelAdapter.class);

    private final Set<String> channels;

    public LocalChannelAdapter(ChannelProperties properties) {
        this.channels = Set.copyOf(new LinkedHashSet<>(properties.local()));
    }

    @Override
    public Set<String> channels() {
        return channels;
    }

    @Override
    public DeliveryResult deliver(NotificationPayload payload, String channel) {
        // 実送信は行わず、ログに残すだけとする
        logger.info("notification simulated send channel={} recipient={} title={}",
                channel,
                payload.recipient(),
                payload.title());
        return DeliveryResult.success();
    }
}
