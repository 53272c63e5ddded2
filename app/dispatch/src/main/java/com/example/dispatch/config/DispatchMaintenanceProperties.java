/*
 * Where: Dispatch application configuration binding
 * What: Holds lease reaper settings
 * Why: Tune how quickly jobs of crashed workers become visible again
 */
package com.example.dispatch.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dispatch.maintenance")
public record DispatchMaintenanceProperties(boolean enabled, Duration reapInterval) {}
