/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.aggregator;

import com.terracottatech.graphquery.AbstractNVPair.LongNVPair;
import com.terracottatech.graphquery.AggregatorOperations;
import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.ValueType;

public class Count extends AbstractAggregator {

  private long count;

  public Count(String attributeName) {
    super(AggregatorOperations.COUNT, attributeName, ValueType.LONG);
  }

  public void accept(NVPair input) {
    count++;
  }

  /**
   * Increment count by given number.
   * 
   * @param delta how much to increment by
   * @throws IllegalArgumentException if delta is negative
   */
  public void increment(long delta) throws IllegalArgumentException {
    if (delta < 0) throw new IllegalArgumentException("argument must not be negative");
    count += delta;
  }

  /**
   * Never null: a count that saw nothing is zero.
   */
  public NVPair getResult() {
    return new LongNVPair(getAttributeName(), count);
  }

}
