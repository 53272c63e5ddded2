/*
 * どこで: Dispatch サービス層
 * 何を: cron 式やタイムゾーンなど配信予定の入力不正を表す
 * なぜ: 受付時点で弾き、不正な schedule_specs 行を作らないため
 */
package com.example.dispatch.service;

public class InvalidScheduleException extends IllegalArgumentException {

  public InvalidScheduleException(String message) {
    super(message);
  }

  public InvalidScheduleException(String message, Throwable cause) {
    super(message, cause);
  }
}
