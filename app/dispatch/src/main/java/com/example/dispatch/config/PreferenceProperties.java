/*
 * Where: Dispatch application configuration binding
 * What: Holds static opt-out rules (user, type, channel, "*" wildcard)
 * Why: Back the default preference store until a user-settings service exists
 */
package com.example.dispatch.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dispatch.preferences")
public record PreferenceProperties(List<OptOut> optOuts) {

  public static final String WILDCARD = "*";

  public PreferenceProperties {
    optOuts = optOuts == null ? List.of() : List.copyOf(optOuts);
  }

  public record OptOut(String userId, String type, String channel) {

    public boolean matches(String userId, String type, String channel) {
      return matchesPart(this.userId, userId)
          && matchesPart(this.type, type)
          && matchesPart(this.channel, channel);
    }

    private static boolean matchesPart(String pattern, String value) {
      return pattern == null || WILDCARD.equals(pattern) || pattern.equals(value);
    }
  }
}
