package ca.gc.cra.sentinel.domain.access;

import java.util.Objects;

/**
 * Identity of a calling actor, supplied explicitly with every mutating registry call.
 *
 * <p>The calling layer (RPC handler, CLI) authenticates the actor and maps it to this value; the registries only
 * compare identities.</p>
 *
 * @param id opaque identifier such as a wallet address or service account; never blank
 * @since 0.1.0
 */
public record Principal(String id) {

  /**
   * Validates and trims the identifier.
   */
  public Principal {
    Objects.requireNonNull(id, "id");
    id = id.trim();
    if (id.isEmpty()) {
      throw new IllegalArgumentException("principal id must not be blank");
    }
  }

  /**
   * Convenience factory.
   *
   * @param id identifier
   * @return principal
   */
  public static Principal of(String id) {
    return new Principal(id);
  }

  @Override
  public String toString() {
    return id;
  }
}
