/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.aggregator;

import com.terracottatech.graphquery.AbstractNVPair.DoubleNVPair;
import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.ValueType;

public class LongAverage extends Average {

  private long sum   = 0;
  private int  count = 0;

  public LongAverage(String attributeName, ValueType type) {
    super(attributeName, type);
  }

  public void accept(NVPair input) throws IllegalArgumentException {
    if (isAbsent(input)) { return; }

    long value = numericValue(input, getAttributeName()).longValue();
    count++;
    sum += value;
  }

  public NVPair getResult() {
    if (count == 0) {
      return null;
    } else {
      return new DoubleNVPair(getAttributeName(), ((double) sum) / count);
    }
  }

}
