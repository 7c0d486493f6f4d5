/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.aggregator;

import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.ValueType;

public interface Aggregator {

  void accept(NVPair input) throws IllegalArgumentException;

  String getAttributeName();

  /**
   * @return the aggregated value named after the attribute, or null if no value was accepted
   */
  NVPair getResult();

  ValueType getType();
}
