/*
 * どこで: Dispatch 運用 API
 * 何を: 手動 flush の結果を表す
 * なぜ: 開いた窓が無かった場合と digest を出した場合を区別するため
 */
package com.example.dispatch.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GroupFlushResponse(String groupKey, boolean flushed, UUID digestJobId) {}
