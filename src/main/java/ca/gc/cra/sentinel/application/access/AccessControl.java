package ca.gc.cra.sentinel.application.access;

import ca.gc.cra.sentinel.application.events.RegistryEventPublisher;
import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.application.port.RegistryEventEmitter;
import ca.gc.cra.sentinel.application.registry.RegistryError;
import ca.gc.cra.sentinel.application.registry.RegistryException;
import ca.gc.cra.sentinel.domain.access.Principal;
import ca.gc.cra.sentinel.domain.access.Role;
import ca.gc.cra.sentinel.domain.events.RegistryEventType;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Capability check gating every mutating registry call.
 * <p><strong>Why:</strong> Threat reports, verifications, and alerts are only meaningful when written by
 * authorized principals; unauthorized calls must leave the ledger untouched.</p>
 * <p><strong>Role:</strong> Shared collaborator of {@code ThreatRegistry} and {@code AlertRegistry}; both consult
 * it identically before touching state.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold a single transferable owner that is implicitly a member of every {@link Role}.</li>
 *   <li>Maintain explicit role memberships, changeable by the owner only.</li>
 *   <li>Reject callers lacking a role with {@link RegistryError#UNAUTHORIZED}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Guarded by an internal read/write lock. Registries take their own write lock
 * first and then only read from this class, so lock order is always registry before access control.</p>
 * <p><strong>Observability:</strong> Emits {@code RoleGranted}, {@code RoleRevoked}, and
 * {@code OwnershipTransferred} events; counts {@code access.role.granted} / {@code access.role.revoked}.</p>
 *
 * @since 0.1.0
 */
public final class AccessControl {
  private static final Logger log = LoggerFactory.getLogger(AccessControl.class);

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<Role, Set<Principal>> members = new EnumMap<>(Role.class);
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final RegistryEventPublisher events;
  private Principal owner;

  /**
   * Creates access control without metrics or event emission.
   *
   * @param owner initial owner; never {@code null}
   */
  public AccessControl(Principal owner) {
    this(owner, ClockPort.SYSTEM, MetricsPort.NO_OP, RegistryEventEmitter.NO_OP);
  }

  /**
   * Creates access control.
   *
   * @param owner initial owner; never {@code null}
   * @param clock time source for event timestamps
   * @param metrics metrics port; {@code null} disables metrics
   * @param emitter event emitter; {@code null} disables events
   */
  public AccessControl(Principal owner, ClockPort clock, MetricsPort metrics, RegistryEventEmitter emitter) {
    this.owner = Objects.requireNonNull(owner, "owner");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.events = new RegistryEventPublisher(emitter, this.metrics);
    for (Role role : Role.values()) {
      members.put(role, new HashSet<>());
    }
  }

  /**
   * @return current owner
   */
  public Principal owner() {
    lock.readLock().lock();
    try {
      return owner;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Tests membership, counting the owner as a member of every role.
   *
   * @param principal candidate; {@code null} is never a member
   * @param role role to test
   * @return whether the principal holds the role
   */
  public boolean hasRole(Principal principal, Role role) {
    Objects.requireNonNull(role, "role");
    if (principal == null) {
      return false;
    }
    lock.readLock().lock();
    try {
      return principal.equals(owner) || members.get(role).contains(principal);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Explicit members of a role. The owner appears only if it was granted explicitly.
   *
   * @param role role to list
   * @return immutable snapshot
   */
  public Set<Principal> members(Role role) {
    Objects.requireNonNull(role, "role");
    lock.readLock().lock();
    try {
      return Set.copyOf(members.get(role));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Fails unless the caller holds the role.
   *
   * @param caller calling principal
   * @param role required role
   * @param operation operation name for diagnostics
   * @throws RegistryException with {@link RegistryError#UNAUTHORIZED}
   */
  public void require(Principal caller, Role role, String operation) {
    if (!hasRole(caller, role)) {
      throw new RegistryException(RegistryError.UNAUTHORIZED,
          operation + " requires role " + role + " (caller " + caller + ")");
    }
  }

  /**
   * Fails unless the caller is the owner.
   *
   * @param caller calling principal
   * @param operation operation name for diagnostics
   * @throws RegistryException with {@link RegistryError#UNAUTHORIZED}
   */
  public void requireOwner(Principal caller, String operation) {
    if (caller == null || !caller.equals(owner())) {
      throw new RegistryException(RegistryError.UNAUTHORIZED,
          operation + " is restricted to the owner (caller " + caller + ")");
    }
  }

  /**
   * Grants a role. Owner only.
   *
   * @param caller calling principal
   * @param role role to grant
   * @param principal grantee
   * @return {@code true} when membership changed; re-granting is a silent no-op without an event
   * @throws RegistryException when the caller is not the owner or the grantee is missing
   */
  public boolean grant(Principal caller, Role role, Principal principal) {
    Objects.requireNonNull(role, "role");
    lock.writeLock().lock();
    try {
      checkOwner(caller, "grantRole");
      if (principal == null) {
        throw rejected(caller, "grantRole",
            new RegistryException(RegistryError.INVALID_INPUT, "principal must not be null"));
      }
      if (!members.get(role).add(principal)) {
        return false;
      }
      metrics.increment("access.role.granted");
      log.debug("Granted {} to {}", role, principal);
      events.publish(RegistryEventType.ROLE_GRANTED, 0L, clock, caller,
          Map.of("role", role.name(), "principal", principal.id()));
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Revokes an explicit role membership. Owner only; the owner's implicit membership cannot be revoked.
   *
   * @param caller calling principal
   * @param role role to revoke
   * @param principal member to remove
   * @return {@code true} when membership changed
   * @throws RegistryException when the caller is not the owner or {@code principal} is the owner
   */
  public boolean revoke(Principal caller, Role role, Principal principal) {
    Objects.requireNonNull(role, "role");
    lock.writeLock().lock();
    try {
      checkOwner(caller, "revokeRole");
      if (principal == null) {
        throw rejected(caller, "revokeRole",
            new RegistryException(RegistryError.INVALID_INPUT, "principal must not be null"));
      }
      if (principal.equals(owner)) {
        throw rejected(caller, "revokeRole",
            new RegistryException(RegistryError.INVALID_INPUT, "cannot revoke " + role + " from the owner"));
      }
      if (!members.get(role).remove(principal)) {
        return false;
      }
      metrics.increment("access.role.revoked");
      log.debug("Revoked {} from {}", role, principal);
      events.publish(RegistryEventType.ROLE_REVOKED, 0L, clock, caller,
          Map.of("role", role.name(), "principal", principal.id()));
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Hands ownership to another principal and grants it every role explicitly so it can operate at once.
   * The previous owner keeps only the memberships it was granted explicitly.
   *
   * @param caller calling principal; must be the owner
   * @param newOwner successor; must differ from the current owner
   * @throws RegistryException when the caller is not the owner, or the successor is missing or unchanged
   */
  public void transferOwnership(Principal caller, Principal newOwner) {
    lock.writeLock().lock();
    try {
      checkOwner(caller, "transferOwnership");
      if (newOwner == null) {
        throw rejected(caller, "transferOwnership",
            new RegistryException(RegistryError.INVALID_INPUT, "new owner must not be null"));
      }
      if (newOwner.equals(owner)) {
        throw rejected(caller, "transferOwnership",
            new RegistryException(RegistryError.INVALID_INPUT, "new owner must differ from current owner"));
      }
      Principal previous = owner;
      owner = newOwner;
      for (Role role : Role.values()) {
        members.get(role).add(newOwner);
      }
      log.info("Ownership transferred from {} to {}", previous, newOwner);
      events.publish(RegistryEventType.OWNERSHIP_TRANSFERRED, 0L, clock, caller,
          Map.of("previousOwner", previous.id(), "newOwner", newOwner.id()));
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void checkOwner(Principal caller, String operation) {
    if (caller == null || !caller.equals(owner)) {
      throw rejected(caller, operation, new RegistryException(RegistryError.UNAUTHORIZED,
          operation + " is restricted to the owner (caller " + caller + ")"));
    }
  }

  private RegistryException rejected(Principal caller, String operation, RegistryException ex) {
    metrics.increment("registry.rejected." + ex.kind().metricName());
    log.warn("Rejected {} by {}: {}", operation, caller, ex.getMessage());
    return ex;
  }
}
