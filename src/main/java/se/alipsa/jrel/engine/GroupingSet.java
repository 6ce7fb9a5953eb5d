package se.alipsa.jrel.engine;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One concrete grouping set, expressed as positions in the key list of a
 * {@link GroupingPlan}.
 */
public final class GroupingSet {

  private final List<Integer> indexes;
  private final Set<Integer> indexSet;

  /**
   * Create a grouping set based on the supplied key indexes.
   *
   * @param indexes
   *          key indexes that participate in the set
   */
  public GroupingSet(List<Integer> indexes) {
    Objects.requireNonNull(indexes, "indexes");
    this.indexes = List.copyOf(indexes);
    indexSet = Set.copyOf(this.indexes);
  }

  public List<Integer> indexes() {
    return indexes;
  }

  /**
   * Determine whether the grouping set includes the specified key.
   *
   * @param index
   *          key index to check
   * @return {@code true} if the key participates in the grouping set
   */
  public boolean contains(int index) {
    return indexSet.contains(index);
  }

  /**
   * The GROUPING_ID of rows produced for this set: the bit of key {@code i} is
   * {@code 1 << (keyCount - 1 - i)} and is set when the key is excluded, so the
   * first key is the most significant bit.
   *
   * @param keyCount
   *          number of keys of the plan
   * @return the bitmask
   */
  public long groupingId(int keyCount) {
    long id = 0L;
    for (int i = 0; i < keyCount; i++) {
      id <<= 1;
      if (!contains(i)) {
        id |= 1L;
      }
    }
    return id;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof GroupingSet other && indexes.equals(other.indexes);
  }

  @Override
  public int hashCode() {
    return indexes.hashCode();
  }

  @Override
  public String toString() {
    return indexes.toString();
  }
}
