package com.example.dispatch.model;

import java.time.Instant;
import java.util.UUID;

public record GroupMember(
    UUID windowId,
    int position,
    UUID jobId,
    String userId,
    String type,
    Priority priority,
    NotificationPayload payload,
    int maxAttempts,
    String traceId,
    Instant createdAt) {}
