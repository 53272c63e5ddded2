/*
 * どこで: Dispatch 運用 API
 * 何を: dead letter 一覧と未 replay 件数のレスポンスを表す
 * なぜ: 一覧と件数を同じ呼び出しで確認できるようにするため
 */
package com.example.dispatch.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeadLettersResponse(long count, List<DeadLetterResponse> items) {}
