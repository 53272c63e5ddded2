/*
 * どこで: Dispatch API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.dispatch.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    JOB_NOT_FOUND,
    DEAD_LETTER_NOT_FOUND,
    SCHEDULE_NOT_FOUND,
    JOB_STATE_CONFLICT,
    DUPLICATE_JOB
}
