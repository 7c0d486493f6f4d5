/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.uid;

import com.terracottatech.graphquery.Configuration;

public final class UidSets {

  private UidSets() {
    //
  }

  public static UidSet empty() {
    return UidList.EMPTY;
  }

  public static UidSetBuilder newBuilder(Configuration cfg) {
    return cfg.useBitSetUids() ? new BitSetUidSet.Builder() : new UidList.Builder();
  }

  /**
   * Intersection of two sets of possibly different implementations. The smaller set is walked and each of its uids
   * probed in the larger one; the result has the smaller set's implementation.
   */
  static UidSet intersectByProbing(UidSet a, UidSet b) {
    UidSet small = a.size() <= b.size() ? a : b;
    UidSet large = small == a ? b : a;

    UidSetBuilder builder = small instanceof BitSetUidSet ? new BitSetUidSet.Builder() : new UidList.Builder();
    for (long uid : small.toArray()) {
      if (large.contains(uid)) {
        builder.add(uid);
      }
    }
    return builder.build();
  }

  static String toString(UidSet set) {
    StringBuilder sb = new StringBuilder(16 + set.size() * 6).append('[');
    long[] uids = set.toArray();
    for (int i = 0; i < uids.length; i++) {
      if (i > 0) sb.append(", ");
      sb.append("0x").append(Long.toHexString(uids[i]));
    }
    return sb.append(']').toString();
  }

}
