package com.example.dispatch.service.schedule;

public enum MaterializeResult {
  ENQUEUED,
  /** 同じ発火分のジョブが既にあるか、別インスタンスが先に進めた。 */
  DUPLICATE,
  RETIRED,
  NOT_DUE
}
