/*
 * どこで: Dispatch 運用 API
 * 何を: 待機中ジョブ数のレスポンスを表す
 * なぜ: priority 未指定(全体)を null として明示するため
 */
package com.example.dispatch.api;

import com.example.dispatch.model.Priority;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueDepthResponse(Priority priority, long depth) {}
