/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

/**
 * Aggregate functions known to the evaluator, keyed by the function name used in queries.
 */
public enum AggregatorOperations {
  COUNT("count"), SUM("sum"), AVERAGE("avg"), MAX("max"), MIN("min");

  private final String functionName;

  private AggregatorOperations(String functionName) {
    this.functionName = functionName;
  }

  public String getFunctionName() {
    return functionName;
  }

  /**
   * @return the operation for {@code name}, or null if it names no aggregate function
   */
  public static AggregatorOperations forFunctionName(String name) {
    for (AggregatorOperations op : values()) {
      if (op.functionName.equals(name)) { return op; }
    }
    return null;
  }

  /**
   * Whether {@code name} is a function that reduces the values of an attribute. Counting is requested through the
   * count flag of a field, not as a function, so "count" is not one of them.
   */
  public static boolean isAggregatorFunction(String name) {
    AggregatorOperations op = forFunctionName(name);
    return op != null && op != COUNT;
  }
}
