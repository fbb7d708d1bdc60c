package com.gentoro.duosmium.actuator;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class HealthServiceTest {

  @Test
  void payloadIsCompactJson() {
    assertEquals("{\"status\":\"ok\",\"service\":\"duosmium-mcp\"}", HealthService.payload());
  }
}
