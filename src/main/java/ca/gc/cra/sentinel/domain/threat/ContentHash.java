package ca.gc.cra.sentinel.domain.threat;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Objects;

/**
 * 32-byte fingerprint of the evidence supporting a threat report.
 *
 * <p>Instances are immutable; accessors hand out copies of the backing array.</p>
 *
 * @since 0.1.0
 */
public final class ContentHash {
  /** Length of a fingerprint in bytes. */
  public static final int LENGTH = 32;
  /** The all-zero fingerprint, rejected by the threat registry. */
  public static final ContentHash ZERO = new ContentHash(new byte[LENGTH]);

  private static final char[] HEX = "0123456789abcdef".toCharArray();

  private final byte[] bytes;

  private ContentHash(byte[] bytes) {
    this.bytes = bytes;
  }

  /**
   * Wraps exactly {@value #LENGTH} raw bytes.
   *
   * @param bytes fingerprint bytes; copied
   * @return fingerprint
   * @throws IllegalArgumentException if the array is not {@value #LENGTH} bytes long
   */
  public static ContentHash of(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes");
    if (bytes.length != LENGTH) {
      throw new IllegalArgumentException("content hash must be " + LENGTH + " bytes (was " + bytes.length + ")");
    }
    return new ContentHash(bytes.clone());
  }

  /**
   * Parses a 64-digit hexadecimal fingerprint with an optional {@code 0x} prefix.
   *
   * @param hex hexadecimal text
   * @return fingerprint
   * @throws IllegalArgumentException if the text is not 64 hexadecimal digits
   */
  public static ContentHash fromHex(String hex) {
    Objects.requireNonNull(hex, "hex");
    String digits = hex.trim();
    if (digits.startsWith("0x") || digits.startsWith("0X")) {
      digits = digits.substring(2);
    }
    if (digits.length() != LENGTH * 2) {
      throw new IllegalArgumentException(
          "content hash must have " + (LENGTH * 2) + " hex digits (was " + digits.length() + ")");
    }
    byte[] out = new byte[LENGTH];
    for (int i = 0; i < LENGTH; i++) {
      int hi = Character.digit(digits.charAt(i * 2), 16);
      int lo = Character.digit(digits.charAt(i * 2 + 1), 16);
      if (hi < 0 || lo < 0) {
        throw new IllegalArgumentException("content hash contains non-hex characters: " + hex);
      }
      out[i] = (byte) ((hi << 4) | lo);
    }
    return new ContentHash(out);
  }

  /**
   * Fingerprints a payload with SHA-256.
   *
   * @param payload evidence bytes
   * @return SHA-256 digest as a fingerprint
   */
  public static ContentHash sha256(byte[] payload) {
    Objects.requireNonNull(payload, "payload");
    try {
      return new ContentHash(MessageDigest.getInstance("SHA-256").digest(payload));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }

  /**
   * @return {@code true} when every byte is zero
   */
  public boolean isZero() {
    for (byte b : bytes) {
      if (b != 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return copy of the fingerprint bytes
   */
  public byte[] bytes() {
    return bytes.clone();
  }

  /**
   * @return lower-case hexadecimal form prefixed with {@code 0x}
   */
  public String toHex() {
    char[] out = new char[LENGTH * 2];
    for (int i = 0; i < LENGTH; i++) {
      out[i * 2] = HEX[(bytes[i] >> 4) & 0xF];
      out[i * 2 + 1] = HEX[bytes[i] & 0xF];
    }
    return "0x" + new String(out);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ContentHash that && Arrays.equals(bytes, that.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return toHex();
  }
}
