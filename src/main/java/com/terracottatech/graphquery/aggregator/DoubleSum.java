/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.aggregator;

import com.terracottatech.graphquery.AbstractNVPair.DoubleNVPair;
import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.ValueType;

public class DoubleSum extends Sum {

  private boolean used = false;
  private double  sum  = 0;

  public DoubleSum(String attributeName, ValueType type) {
    super(attributeName, type);
  }

  public void accept(NVPair input) throws IllegalArgumentException {
    if (isAbsent(input)) { return; }

    sum += numericValue(input, getAttributeName()).doubleValue();
    used = true;
  }

  public NVPair getResult() {
    if (used) {
      return new DoubleNVPair(getAttributeName(), sum);
    } else {
      return null;
    }
  }
}
