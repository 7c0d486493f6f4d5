/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.aggregator;

import com.terracottatech.graphquery.AggregatorOperations;
import com.terracottatech.graphquery.ValueType;

/**
 * Averages always produce a {@link ValueType#DOUBLE} result.
 */
public abstract class Average extends AbstractAggregator {

  Average(String attributeName, ValueType type) {
    super(AggregatorOperations.AVERAGE, attributeName, type);
  }

  public static Average average(String attributeName, ValueType type) {
    if (type == null) { return new EmptyAverage(attributeName); }

    switch (type) {
      case INT:
      case LONG:
        return new LongAverage(attributeName, type);
      case FLOAT:
      case DOUBLE:
        return new DoubleAverage(attributeName, type);
      default:
        throw new IllegalArgumentException("avg is not supported for " + type + " attribute [" + attributeName + "]");
    }
  }

}
