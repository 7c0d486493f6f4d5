/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.uid;

import org.apache.lucene.util.OpenBitSet;

import com.terracottatech.graphquery.QueryException;

/**
 * {@link UidSet} backed by a Lucene {@link OpenBitSet}. Only uids from 0 to {@link #MAX_UID} can be held, since the bit
 * set addresses its words with an int. The bit set is sized by the largest uid.
 */
public final class BitSetUidSet implements UidSet {

  /**
   * Largest uid a bit set can hold: its word index ({@code uid >>> 6}) must stay below {@code Integer.MAX_VALUE}.
   */
  public static final long MAX_UID = ((long) Integer.MAX_VALUE << 6) - 1;

  private final OpenBitSet bits;
  private final int        size;

  private BitSetUidSet(OpenBitSet bits) {
    this.bits = bits;
    long cardinality = bits.cardinality();
    if (cardinality > Integer.MAX_VALUE) { throw new IllegalArgumentException("Too many uids: " + cardinality); }
    this.size = (int) cardinality;
  }

  public static BitSetUidSet of(long... uids) {
    Builder builder = new Builder();
    for (long uid : uids) {
      builder.add(uid);
    }
    return builder.build();
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  public boolean contains(long uid) {
    return inRange(uid) && bits.get(uid);
  }

  public void iterate(UidVisitor visitor) throws QueryException {
    for (long uid = bits.nextSetBit(0L); uid >= 0; uid = bits.nextSetBit(uid + 1)) {
      visitor.visit(uid);
    }
  }

  public UidSet intersect(UidSet other) {
    if (other instanceof BitSetUidSet) {
      OpenBitSet copy = (OpenBitSet) bits.clone();
      copy.intersect(((BitSetUidSet) other).bits);
      return new BitSetUidSet(copy);
    }
    return UidSets.intersectByProbing(this, other);
  }

  public long[] toArray() {
    long[] out = new long[size];
    int n = 0;
    for (long uid = bits.nextSetBit(0L); uid >= 0; uid = bits.nextSetBit(uid + 1)) {
      out[n++] = uid;
    }
    return out;
  }

  static boolean inRange(long uid) {
    return uid >= 0 && (uid >>> 6) < Integer.MAX_VALUE;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null) return false;
    if (getClass() != obj.getClass()) return false;
    return bits.equals(((BitSetUidSet) obj).bits);
  }

  @Override
  public int hashCode() {
    return bits.hashCode();
  }

  @Override
  public String toString() {
    return UidSets.toString(this);
  }

  static final class Builder implements UidSetBuilder {

    private final OpenBitSet bits = new OpenBitSet();

    public Builder add(long uid) {
      if (!inRange(uid)) {
        //
        throw new IllegalArgumentException("uid " + Long.toUnsignedString(uid) + " is out of range for a bit set");
      }
      bits.set(uid);
      return this;
    }

    public boolean isEmpty() {
      return bits.isEmpty();
    }

    public BitSetUidSet build() {
      return new BitSetUidSet((OpenBitSet) bits.clone());
    }
  }

}
