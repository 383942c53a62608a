package ca.gc.cra.sentinel.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the meter used by {@link OpenTelemetryMetricsAdapter} from the exporter named in the registry
 * configuration.
 *
 * <p>{@code OTEL_EXPORTER_OTLP_ENDPOINT} is consulted only when the configured endpoint is blank. Any failure
 * while wiring the SDK yields a noop handle so the registries keep running without metrics.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.sentinel";
  private static final String SCOPE_VERSION = "0.1.0";
  private static final String FALLBACK_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long WAIT_SECONDS = 5;

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static MeterHandle initialize(String exporter, String endpoint) {
    String mode = exporter == null ? "" : exporter.trim().toLowerCase(Locale.ROOT);
    switch (mode) {
      case "", "none" -> {
        log.info("OpenTelemetry metrics disabled (exporter={})", mode.isEmpty() ? "unset" : mode);
        return MeterHandle.noop();
      }
      case "otlp" -> {
        try {
          return otlp(endpointOrDefault(endpoint));
        } catch (RuntimeException ex) {
          log.error("Failed to initialize OpenTelemetry metrics; continuing without them", ex);
          return MeterHandle.noop();
        }
      }
      default -> {
        log.warn("Unknown metrics exporter '{}'; metrics disabled", exporter);
        return MeterHandle.noop();
      }
    }
  }

  static MeterHandle forTesting(MetricReader reader) {
    return MeterHandle.of(providerWith(Objects.requireNonNull(reader, "reader")));
  }

  private static MeterHandle otlp(String endpoint) {
    MetricReader reader = PeriodicMetricReader
        .builder(OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
        .setInterval(EXPORT_INTERVAL)
        .build();
    MeterHandle handle = MeterHandle.of(providerWith(reader));
    log.info("OpenTelemetry metrics exporting over OTLP to {} every {}s", endpoint, EXPORT_INTERVAL.toSeconds());
    return handle;
  }

  private static SdkMeterProvider providerWith(MetricReader reader) {
    return SdkMeterProvider.builder()
        .setResource(Resource.getDefault().merge(Resource.create(serviceAttributes())))
        .registerMetricReader(reader)
        .build();
  }

  private static Attributes serviceAttributes() {
    return Attributes.of(
        AttributeKey.stringKey("service.name"), "sentinel",
        AttributeKey.stringKey("service.namespace"), "ca.gc.cra",
        AttributeKey.stringKey("service.instance.id"), instanceId());
  }

  private static String instanceId() {
    String pid = Long.toString(ProcessHandle.current().pid());
    try {
      return InetAddress.getLocalHost().getHostName() + "-" + pid;
    } catch (UnknownHostException ex) {
      log.debug("Host name unavailable; instance id falls back to pid", ex);
      return "pid-" + pid;
    }
  }

  private static String endpointOrDefault(String configured) {
    if (configured != null && !configured.isBlank()) {
      return configured.trim();
    }
    String env = System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT");
    return env == null || env.isBlank() ? FALLBACK_ENDPOINT : env.trim();
  }

  /**
   * Meter plus the SDK provider behind it; a {@code null} provider means metrics are disabled.
   */
  record MeterHandle(Meter meter, SdkMeterProvider provider) implements AutoCloseable {

    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static MeterHandle of(SdkMeterProvider provider) {
      Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(SCOPE_VERSION).build();
      return new MeterHandle(meter, provider);
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      await("flush", SdkMeterProvider::forceFlush);
    }

    @Override
    public void close() {
      await("shutdown", SdkMeterProvider::shutdown);
    }

    private void await(String action, Function<SdkMeterProvider, CompletableResultCode> call) {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode result = call.apply(provider).join(WAIT_SECONDS, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
          log.warn("OpenTelemetry meter provider {} did not complete within {}s", action, WAIT_SECONDS);
        }
      } catch (RuntimeException ex) {
        log.warn("OpenTelemetry meter provider {} failed", action, ex);
      }
    }
  }
}
