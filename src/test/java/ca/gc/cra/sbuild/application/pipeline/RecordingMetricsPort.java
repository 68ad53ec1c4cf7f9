package ca.gc.cra.sbuild.application.pipeline;

import ca.gc.cra.sbuild.application.port.MetricsPort;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, Long> counters = new ConcurrentHashMap<>();
  private final Map<String, Long> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.merge(key, 1L, Long::sum);
  }

  @Override
  public void observe(String key, long value) {
    observations.merge(key, 1L, Long::sum);
  }

  long count(String key) {
    return counters.getOrDefault(key, 0L);
  }

  long observations(String key) {
    return observations.getOrDefault(key, 0L);
  }
}
