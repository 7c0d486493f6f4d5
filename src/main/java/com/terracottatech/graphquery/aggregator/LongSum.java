/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.aggregator;

import com.terracottatech.graphquery.AbstractNVPair.LongNVPair;
import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.ValueType;

public class LongSum extends Sum {

  private boolean used = false;
  private long    sum  = 0;

  public LongSum(String attributeName, ValueType type) {
    super(attributeName, type);
  }

  public void accept(NVPair input) throws IllegalArgumentException {
    if (isAbsent(input)) { return; }

    sum += numericValue(input, getAttributeName()).longValue();
    used = true;
  }

  public NVPair getResult() {
    if (used) {
      return new LongNVPair(getAttributeName(), sum);
    } else {
      return null;
    }
  }

}
