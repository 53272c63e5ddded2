/*
 * Where: Dispatch intake
 * What: Answers opt-out lookups from dispatch.preferences.opt-outs
 * Why: Provide a working default until a user-settings service backs the store
 */
package com.example.dispatch.service.orchestrator;

import com.example.dispatch.config.PreferenceProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConfiguredPreferenceStore implements PreferenceStore {

  private final PreferenceProperties properties;

  @Override
  public boolean shouldSend(String userId, String type, String channel) {
    return properties.optOuts().stream().noneMatch(optOut -> optOut.matches(userId, type, channel));
  }
}
