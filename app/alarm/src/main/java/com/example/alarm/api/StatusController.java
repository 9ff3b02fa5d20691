/*
 * Where: Alarm API
 * What: Plain root response for liveness checks behind the load balancer
 */
package com.example.alarm.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "alarm: ok";
  }
}
