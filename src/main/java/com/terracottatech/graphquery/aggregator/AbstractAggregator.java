/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.aggregator;

import com.terracottatech.graphquery.AggregatorOperations;
import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.ValueType;

public abstract class AbstractAggregator implements Aggregator {

  private final String               attributeName;
  private final ValueType            type;
  private final AggregatorOperations operation;

  AbstractAggregator(AggregatorOperations operation, String attributeName, ValueType type) {
    this.attributeName = attributeName;
    this.type = type;
    this.operation = operation;
  }

  public final String getAttributeName() {
    return attributeName;
  }

  public ValueType getType() {
    return type;
  }

  public final AggregatorOperations getOperation() {
    return operation;
  }

  static boolean isAbsent(NVPair input) {
    return input == null || input.getType() == ValueType.NULL;
  }

  static Number numericValue(NVPair input, String attributeName) throws IllegalArgumentException {
    if (!input.getType().isNumeric()) { throw new IllegalArgumentException(input.getType() + " is not a number for attribute ["
                                                                           + attributeName + "]"); }
    return (Number) input.getObjectValue();
  }

  /**
   * @param type declared type of the attribute, or null if the attribute is untyped
   * @throws IllegalArgumentException if {@code operation} cannot be applied to {@code type}
   */
  public static AbstractAggregator aggregator(AggregatorOperations operation, String attributeName, ValueType type) {
    switch (operation) {
      case AVERAGE:
        return Average.average(attributeName, type);
      case COUNT:
        return new Count(attributeName);
      case MAX:
        return MinMax.max(attributeName, type);
      case MIN:
        return MinMax.min(attributeName, type);
      case SUM:
        return Sum.sum(attributeName, type);
    }
    throw new IllegalArgumentException(String.valueOf(operation));
  }
}
