package ca.gc.cra.sentinel.application.registry;

import java.util.Objects;

/**
 * Unchecked failure raised by registry and access-control operations.
 *
 * <p>A thrown {@code RegistryException} guarantees that no record, counter, or index changed.</p>
 *
 * @since 0.1.0
 */
public class RegistryException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final RegistryError kind;

  /**
   * Creates an exception of the given kind.
   *
   * @param kind failure kind; never {@code null}
   * @param message diagnostic message
   */
  public RegistryException(RegistryError kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates an exception of the given kind wrapping a validation cause.
   *
   * @param kind failure kind; never {@code null}
   * @param message diagnostic message
   * @param cause underlying failure
   */
  public RegistryException(RegistryError kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * @return failure kind
   */
  public RegistryError kind() {
    return kind;
  }

  static RegistryException unauthorized(String message) {
    return new RegistryException(RegistryError.UNAUTHORIZED, message);
  }

  static RegistryException notFound(String what, long id) {
    return new RegistryException(RegistryError.NOT_FOUND, what + " " + id + " does not exist");
  }

  static RegistryException invalidInput(String message) {
    return new RegistryException(RegistryError.INVALID_INPUT, message);
  }

  static RegistryException noOp(String what, long id, Object status) {
    return new RegistryException(RegistryError.NO_OP_REJECTED, what + " " + id + " is already " + status);
  }
}
