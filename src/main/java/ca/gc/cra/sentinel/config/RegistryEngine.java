package ca.gc.cra.sentinel.config;

import ca.gc.cra.sentinel.application.access.AccessControl;
import ca.gc.cra.sentinel.application.registry.AlertRegistry;
import ca.gc.cra.sentinel.application.registry.ThreatRegistry;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A wired registry engine: one access control shared by the threat and alert registries, plus the adapters
 * that must be closed on shutdown.
 *
 * @since 0.1.0
 */
public final class RegistryEngine implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RegistryEngine.class);

  private final AccessControl access;
  private final ThreatRegistry threats;
  private final AlertRegistry alerts;
  private final List<AutoCloseable> resources;

  RegistryEngine(AccessControl access, ThreatRegistry threats, AlertRegistry alerts, List<AutoCloseable> resources) {
    this.access = Objects.requireNonNull(access, "access");
    this.threats = Objects.requireNonNull(threats, "threats");
    this.alerts = Objects.requireNonNull(alerts, "alerts");
    this.resources = List.copyOf(resources);
  }

  public AccessControl access() {
    return access;
  }

  public ThreatRegistry threats() {
    return threats;
  }

  public AlertRegistry alerts() {
    return alerts;
  }

  /**
   * Closes emitters and metrics adapters in creation order; failures are logged and do not stop the rest.
   */
  @Override
  public void close() {
    for (AutoCloseable resource : resources) {
      try {
        resource.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}", resource.getClass().getSimpleName(), ex);
      }
    }
  }
}
