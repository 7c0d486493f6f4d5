/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.uid;

import com.terracottatech.graphquery.QueryException;

import java.util.Arrays;

/**
 * {@link UidSet} over a sorted, duplicate free {@code long[]}.
 */
public final class UidList implements UidSet {

  static final UidList EMPTY = new UidList(new long[0]);

  private final long[] uids;

  private UidList(long[] sortedUnique) {
    this.uids = sortedUnique;
  }

  public static UidList of(long... uids) {
    return new UidList(sortUnique(uids.clone(), uids.length));
  }

  public int size() {
    return uids.length;
  }

  public boolean isEmpty() {
    return uids.length == 0;
  }

  public boolean contains(long uid) {
    return indexOf(uid) >= 0;
  }

  public void iterate(UidVisitor visitor) throws QueryException {
    for (long uid : uids) {
      visitor.visit(uid);
    }
  }

  public UidSet intersect(UidSet other) {
    if (other instanceof UidList) { return intersect(this, (UidList) other); }
    return UidSets.intersectByProbing(this, other);
  }

  public long[] toArray() {
    return uids.clone();
  }

  private int indexOf(long uid) {
    int low = 0;
    int high = uids.length - 1;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      int cmp = Long.compareUnsigned(uids[mid], uid);
      if (cmp < 0) {
        low = mid + 1;
      } else if (cmp > 0) {
        high = mid - 1;
      } else {
        return mid;
      }
    }
    return -(low + 1);
  }

  private static UidList intersect(UidList a, UidList b) {
    if (a.isEmpty() || b.isEmpty()) { return EMPTY; }

    long[] out = new long[Math.min(a.uids.length, b.uids.length)];
    int n = 0;
    int i = 0;
    int j = 0;
    while (i < a.uids.length && j < b.uids.length) {
      int cmp = Long.compareUnsigned(a.uids[i], b.uids[j]);
      if (cmp < 0) {
        i++;
      } else if (cmp > 0) {
        j++;
      } else {
        out[n++] = a.uids[i];
        i++;
        j++;
      }
    }
    return n == 0 ? EMPTY : new UidList(n == out.length ? out : Arrays.copyOf(out, n));
  }

  /**
   * Sorts the first {@code length} entries of {@code uids} in unsigned order and drops duplicates.
   */
  static long[] sortUnique(long[] uids, int length) {
    // flipping the sign bit turns unsigned order into signed order
    for (int i = 0; i < length; i++) {
      uids[i] ^= Long.MIN_VALUE;
    }
    Arrays.sort(uids, 0, length);
    int n = 0;
    for (int i = 0; i < length; i++) {
      if (n == 0 || uids[n - 1] != uids[i]) {
        uids[n++] = uids[i];
      }
    }
    for (int i = 0; i < n; i++) {
      uids[i] ^= Long.MIN_VALUE;
    }
    return n == uids.length ? uids : Arrays.copyOf(uids, n);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null) return false;
    if (getClass() != obj.getClass()) return false;
    return Arrays.equals(uids, ((UidList) obj).uids);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(uids);
  }

  @Override
  public String toString() {
    return UidSets.toString(this);
  }

  static final class Builder implements UidSetBuilder {

    private long[]  buf    = new long[8];
    private int     size   = 0;
    private boolean sorted = true;

    public Builder add(long uid) {
      if (size == buf.length) {
        buf = Arrays.copyOf(buf, size << 1);
      }
      if (size > 0 && Long.compareUnsigned(buf[size - 1], uid) >= 0) {
        sorted = false;
      }
      buf[size++] = uid;
      return this;
    }

    public boolean isEmpty() {
      return size == 0;
    }

    public UidList build() {
      if (size == 0) { return EMPTY; }
      if (sorted) { return new UidList(Arrays.copyOf(buf, size)); }
      return new UidList(sortUnique(Arrays.copyOf(buf, size), size));
    }
  }

}
