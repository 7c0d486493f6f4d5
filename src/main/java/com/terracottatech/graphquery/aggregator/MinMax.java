/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.aggregator;

import com.terracottatech.graphquery.AggregatorOperations;
import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.TypedValues;
import com.terracottatech.graphquery.ValueType;
import com.terracottatech.graphquery.ValueTypeException;

public class MinMax extends AbstractAggregator {

  private final boolean min;

  private NVPair        result;

  private MinMax(AggregatorOperations operation, String attributeName, boolean min, ValueType type) {
    super(operation, attributeName, type);
    this.min = min;
  }

  public static MinMax min(String attributeName, ValueType type) {
    return new MinMax(AggregatorOperations.MIN, attributeName, true, type);
  }

  public static MinMax max(String attributeName, ValueType type) {
    return new MinMax(AggregatorOperations.MAX, attributeName, false, type);
  }

  public NVPair getResult() {
    if (result == null) { return null; }
    return result.getName().equals(getAttributeName()) ? result : result.cloneWithNewName(getAttributeName());
  }

  public void accept(NVPair input) throws IllegalArgumentException {
    if (isAbsent(input)) { return; }

    if (result == null) {
      result = input;
      return;
    }

    final boolean replace;
    try {
      replace = min ? TypedValues.less(input, result) : TypedValues.less(result, input);
    } catch (ValueTypeException vte) {
      throw new IllegalArgumentException(getAttributeName(), vte);
    }

    if (replace) {
      result = input;
    }
  }

}
