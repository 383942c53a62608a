package ca.gc.cra.sentinel.config;

import ca.gc.cra.sentinel.application.access.AccessControl;
import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.application.port.RegistryEventEmitter;
import ca.gc.cra.sentinel.application.registry.AlertRegistry;
import ca.gc.cra.sentinel.application.registry.ThreatRegistry;
import ca.gc.cra.sentinel.domain.access.Principal;
import ca.gc.cra.sentinel.infrastructure.events.CompositeRegistryEventEmitter;
import ca.gc.cra.sentinel.infrastructure.events.KafkaRegistryEventEmitter;
import ca.gc.cra.sentinel.infrastructure.events.LoggingRegistryEventEmitter;
import ca.gc.cra.sentinel.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.sentinel.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.sentinel.infrastructure.time.SystemClockAdapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires a {@link RegistryEngine} from a {@link RegistryConfig}.
 * <p><strong>Why:</strong> Keeps adapter selection (clock, metrics exporter, event sink) in one place so the
 * registries only ever see ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Choose the metrics adapter from {@code metricsExporter}.</li>
 *   <li>Choose the event emitter from {@code eventSink}; an extra emitter (for example an in-memory recorder) can
 *   be appended for diagnostics.</li>
 *   <li>Create one {@link AccessControl} and share it with both registries.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not synchronized; build on the startup thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final RegistryConfig config;
  private final ClockPort clock;
  private final MetricsPort metricsOverride;

  /**
   * Creates a root using the system clock and the configured metrics exporter.
   *
   * @param config resolved configuration
   */
  public CompositionRoot(RegistryConfig config) {
    this(config, new SystemClockAdapter(), null);
  }

  /**
   * Creates a root with explicit clock and metrics, used by tests.
   *
   * @param config resolved configuration
   * @param clock time source
   * @param metrics metrics port; {@code null} builds one from {@code config.metricsExporter()}
   */
  public CompositionRoot(RegistryConfig config, ClockPort clock, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metricsOverride = metrics;
  }

  /**
   * Builds an engine with the configured event sink.
   *
   * @return engine owning its adapters
   */
  public RegistryEngine build() {
    return build(null);
  }

  /**
   * Builds an engine whose events also reach {@code extra}.
   *
   * @param extra additional emitter appended after the configured sink; may be {@code null}
   * @return engine owning its adapters
   */
  public RegistryEngine build(RegistryEventEmitter extra) {
    List<AutoCloseable> resources = new ArrayList<>();
    MetricsPort metrics = metricsOverride != null ? metricsOverride : createMetrics(resources);
    RegistryEventEmitter emitter = createEmitter(extra);
    resources.add(0, emitter);

    Principal owner = Principal.of(config.owner());
    AccessControl access = new AccessControl(owner, clock, metrics, emitter);
    ThreatRegistry threats = new ThreatRegistry(access, clock, metrics, emitter);
    AlertRegistry alerts = new AlertRegistry(access, clock, metrics, emitter,
        config.emergencyThreshold(), config.recentWindowCapacity());
    log.info("Registry engine ready owner={} emergencyThreshold={} recentWindow={} eventSink={} metrics={}",
        owner, config.emergencyThreshold(), config.recentWindowCapacity(), config.eventSink(),
        config.metricsExporter());
    return new RegistryEngine(access, threats, alerts, resources);
  }

  private MetricsPort createMetrics(List<AutoCloseable> resources) {
    if ("none".equals(config.metricsExporter())) {
      return NoOpMetricsAdapter.INSTANCE;
    }
    OpenTelemetryMetricsAdapter adapter =
        new OpenTelemetryMetricsAdapter(config.metricsExporter(), config.otlpEndpoint());
    resources.add(adapter);
    return adapter;
  }

  private RegistryEventEmitter createEmitter(RegistryEventEmitter extra) {
    RegistryEventEmitter sink = switch (config.eventSink()) {
      case LOG -> new LoggingRegistryEventEmitter();
      case KAFKA -> new KafkaRegistryEventEmitter(config.kafkaBootstrap().orElseThrow(), config.kafkaTopic());
      case NONE -> RegistryEventEmitter.NO_OP;
    };
    if (extra == null) {
      return sink;
    }
    return new CompositeRegistryEventEmitter(List.of(sink, extra));
  }
}
