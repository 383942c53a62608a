package ca.gc.cra.sentinel.application.index;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Set of record identifiers with O(1) add, O(1) removal, and positional access.
 *
 * <p>Identifiers are kept in a dense array in insertion order. Removal moves the last identifier into the vacated
 * slot and truncates, so order is only meaningful until the first removal. A position map keeps removal
 * constant-time instead of scanning the array.</p>
 *
 * <p>Not thread-safe; owners guard it with their registry lock.</p>
 *
 * @since 0.1.0
 */
public final class IndexedIdSet {
  private long[] ids = new long[16];
  private int size;
  private final Map<Long, Integer> positions = new HashMap<>();

  /**
   * Appends an identifier.
   *
   * @param id identifier
   * @return {@code false} when already present
   */
  public boolean add(long id) {
    if (positions.containsKey(id)) {
      return false;
    }
    if (size == ids.length) {
      ids = Arrays.copyOf(ids, size * 2);
    }
    ids[size] = id;
    positions.put(id, size);
    size++;
    return true;
  }

  /**
   * Removes an identifier by swapping the last identifier into its slot.
   *
   * @param id identifier
   * @return {@code false} when absent
   */
  public boolean remove(long id) {
    Integer slot = positions.remove(id);
    if (slot == null) {
      return false;
    }
    int last = size - 1;
    if (slot != last) {
      long moved = ids[last];
      ids[slot] = moved;
      positions.put(moved, slot);
    }
    size = last;
    return true;
  }

  /**
   * @param id identifier
   * @return whether the identifier is present
   */
  public boolean contains(long id) {
    return positions.containsKey(id);
  }

  /**
   * @param index position in {@code [0, size)}
   * @return identifier at that position
   */
  public long get(int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("index " + index + " outside [0, " + size + ")");
    }
    return ids[index];
  }

  /**
   * @return number of identifiers
   */
  public int size() {
    return size;
  }

  /**
   * @return identifiers in current positional order
   */
  public List<Long> toList() {
    return Arrays.stream(ids, 0, size).boxed().toList();
  }
}
