package ca.gc.cra.sentinel.application.index;

import java.util.ArrayList;
import java.util.List;

/**
 * Ring buffer holding the most recent {@code capacity} identifiers in arrival order.
 *
 * <p>Appending to a full window evicts the oldest identifier. Not thread-safe; guarded by the owning registry.</p>
 *
 * @since 0.1.0
 */
public final class BoundedIdWindow {
  private final long[] slots;
  private int head;
  private int size;

  /**
   * @param capacity maximum retained identifiers; must be positive
   */
  public BoundedIdWindow(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive (was " + capacity + ")");
    }
    this.slots = new long[capacity];
  }

  /**
   * Appends an identifier, evicting the oldest one when full.
   *
   * @param id identifier
   * @return the evicted identifier, or {@code -1} when nothing was evicted
   */
  public long append(long id) {
    if (size < slots.length) {
      slots[(head + size) % slots.length] = id;
      size++;
      return -1L;
    }
    long evicted = slots[head];
    slots[head] = id;
    head = (head + 1) % slots.length;
    return evicted;
  }

  /**
   * @param index position where {@code 0} is the oldest retained identifier
   * @return identifier at that position
   */
  public long get(int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("index " + index + " outside [0, " + size + ")");
    }
    return slots[(head + index) % slots.length];
  }

  /**
   * @return retained identifier count, never above {@link #capacity()}
   */
  public int size() {
    return size;
  }

  /**
   * @return maximum retained identifiers
   */
  public int capacity() {
    return slots.length;
  }

  /**
   * @return retained identifiers, oldest first
   */
  public List<Long> toList() {
    List<Long> out = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      out.add(get(i));
    }
    return List.copyOf(out);
  }
}
