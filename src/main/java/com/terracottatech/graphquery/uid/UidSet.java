/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.uid;

import com.terracottatech.graphquery.QueryException;

/**
 * Immutable, sorted set of entity uids. Uids order as unsigned 64-bit values.
 */
public interface UidSet {

  int size();

  boolean isEmpty();

  boolean contains(long uid);

  void iterate(UidVisitor visitor) throws QueryException;

  /**
   * @return a new set holding the uids present in both this set and {@code other}
   */
  UidSet intersect(UidSet other);

  long[] toArray();

}
