package com.tapmap.fountains.application.port.in;

import java.util.Map;

public interface CheckHealthUseCase {

  /**
   * Probe the fountain store.
   *
   * @return Health body; {@code status} is "healthy" or "unhealthy"
   */
  Map<String, Object> checkHealth();
}
