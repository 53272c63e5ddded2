/*
 * どこで: Dispatch API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: actuator を使わない疎通確認の入口として残すため
 */
package com.example.dispatch.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "dispatch: ok";
  }
}
