/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.aggregator;

import com.terracottatech.graphquery.AggregatorOperations;
import com.terracottatech.graphquery.ValueType;

public abstract class Sum extends AbstractAggregator {

  Sum(String attributeName, ValueType type) {
    super(AggregatorOperations.SUM, attributeName, type);
  }

  public static Sum sum(String attributeName, ValueType type) {
    if (type == null) { return new EmptySum(attributeName); }

    switch (type) {
      case INT:
      case LONG:
        return new LongSum(attributeName, type);
      case FLOAT:
      case DOUBLE:
        return new DoubleSum(attributeName, type);
      default:
        throw new IllegalArgumentException("sum is not supported for " + type + " attribute [" + attributeName + "]");
    }
  }

}
