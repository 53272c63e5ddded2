package com.example.dispatch.service.ratelimit;

public final class RateLimitKeys {

  static final String CHANNEL_PREFIX = "channel:";
  static final String USER_PREFIX = "user:";

  private RateLimitKeys() {}

  public static String channel(String channel) {
    return CHANNEL_PREFIX + channel;
  }

  public static String user(String userId, String channel) {
    return USER_PREFIX + userId + ":" + channel;
  }
}
