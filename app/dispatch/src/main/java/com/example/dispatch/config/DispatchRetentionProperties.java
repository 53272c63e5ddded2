/*
 * Where: Dispatch application configuration binding
 * What: Holds retention cleanup settings
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.example.dispatch.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dispatch.retention")
public record DispatchRetentionProperties(
                boolean enabled,
                int retentionDays,
                Duration cleanupInterval) {
}
