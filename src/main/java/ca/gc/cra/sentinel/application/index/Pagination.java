package ca.gc.cra.sentinel.application.index;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToLongFunction;

/**
 * Offset/limit slicing over positional identifier indices.
 *
 * <p>Forward slices walk positions {@code offset, offset+1, ...}; reverse slices walk from the newest position
 * backwards, so offset {@code 0} is the most recently appended identifier. An offset at or beyond the index size
 * yields an empty page.</p>
 *
 * @since 0.1.0
 */
public final class Pagination {
  /** Largest page a registry query may request. */
  public static final int MAX_LIMIT = 100;

  private Pagination() {
    // Utility
  }

  /**
   * Slices positions in ascending order.
   *
   * @param size number of positions in the index
   * @param at accessor from position to identifier
   * @param offset first position to return; non-negative
   * @param limit maximum page size; positive
   * @return identifiers in ascending position order
   */
  public static List<Long> forward(int size, IntToLongFunction at, int offset, int limit) {
    check(offset, limit);
    if (offset >= size) {
      return List.of();
    }
    int end = (int) Math.min((long) offset + limit, size);
    List<Long> page = new ArrayList<>(end - offset);
    for (int i = offset; i < end; i++) {
      page.add(at.applyAsLong(i));
    }
    return List.copyOf(page);
  }

  /**
   * Slices positions newest first.
   *
   * @param size number of positions in the index
   * @param at accessor from position to identifier, position {@code 0} being the oldest
   * @param offset number of newest identifiers to skip; non-negative
   * @param limit maximum page size; positive
   * @return identifiers in descending position order
   */
  public static List<Long> reverse(int size, IntToLongFunction at, int offset, int limit) {
    check(offset, limit);
    if (offset >= size) {
      return List.of();
    }
    int count = (int) Math.min(limit, (long) size - offset);
    List<Long> page = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      page.add(at.applyAsLong(size - 1 - offset - i));
    }
    return List.copyOf(page);
  }

  /**
   * Forward slice over a list.
   *
   * @param ids identifiers in index order
   * @param offset first position
   * @param limit maximum page size
   * @return slice
   */
  public static List<Long> forward(List<Long> ids, int offset, int limit) {
    return forward(ids.size(), ids::get, offset, limit);
  }

  /**
   * Reverse slice over a list whose last element is the newest.
   *
   * @param ids identifiers in index order
   * @param offset number of newest identifiers to skip
   * @param limit maximum page size
   * @return slice
   */
  public static List<Long> reverse(List<Long> ids, int offset, int limit) {
    return reverse(ids.size(), ids::get, offset, limit);
  }

  private static void check(int offset, int limit) {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative (was " + offset + ")");
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive (was " + limit + ")");
    }
  }
}
