package ca.gc.cra.sbuild.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private SdkMeterProvider provider;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    provider = SdkMeterProvider.builder().registerMetricReader(reader).build();
    adapter = new OpenTelemetryMetricsAdapter(provider.get("ca.gc.cra.sbuild"));
  }

  @AfterEach
  void tearDown() {
    provider.close();
  }

  @Test
  void incrementRecordsCounter() {
    adapter.increment("lint.files.validated");
    adapter.increment("lint.files.validated");
    adapter.increment("lint.files.failed");

    Collection<MetricData> metrics = reader.collectAllMetrics();
    MetricData validated = find(metrics, "lint.files.validated");

    assertEquals(MetricDataType.LONG_SUM, validated.getType());
    assertEquals(2L, validated.getLongSumData().getPoints().iterator().next().getValue());
    assertEquals(1L, find(metrics, "lint.files.failed").getLongSumData().getPoints().iterator().next().getValue());
  }

  @Test
  void observeRecordsHistogramInNanoseconds() {
    adapter.observe("lint.job.latencyNanos", 1_000L);
    adapter.observe("lint.job.latencyNanos", 3_000L);

    MetricData latency = find(reader.collectAllMetrics(), "lint.job.latencynanos");

    assertEquals(MetricDataType.HISTOGRAM, latency.getType());
    assertEquals("ns", latency.getUnit());
    HistogramPointData point = latency.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000d, point.getSum());
  }

  @Test
  void sanitizesMetricNames() {
    assertEquals("lint.files.validated", OpenTelemetryMetricsAdapter.sanitizeName("lint.files.validated"));
    assertEquals("lint.job.latencynanos", OpenTelemetryMetricsAdapter.sanitizeName("lint.job.latencyNanos"));
    assertEquals("m9_files", OpenTelemetryMetricsAdapter.sanitizeName("9 files"));
    assertEquals("lint.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void globalMeterIsSafeWithoutSdk() {
    OpenTelemetryMetricsAdapter global = new OpenTelemetryMetricsAdapter();

    assertDoesNotThrow(() -> {
      global.increment("lint.files.timeout");
      global.observe("lint.job.latencyNanos", 1L);
    });
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric not exported: " + name));
  }
}
