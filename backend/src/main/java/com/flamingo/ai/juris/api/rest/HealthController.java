package com.flamingo.ai.juris.api.rest;

import com.flamingo.ai.juris.service.content.ContentProcessor;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final ContentProcessor contentProcessor;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "juris");
    health.put("supportedFormats", contentProcessor.supportedFormats());
    return ResponseEntity.ok(health);
  }
}
