/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.aggregator;

import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.ValueType;

public class EmptyAverage extends Average {

  private Average delegate;

  public EmptyAverage(String attributeName) {
    super(attributeName, null);
  }

  public void accept(NVPair input) throws IllegalArgumentException {
    if (isAbsent(input)) { return; }

    if (delegate == null) {
      delegate = Average.average(getAttributeName(), input.getType());
    }
    delegate.accept(input);
  }

  @Override
  public ValueType getType() {
    return delegate == null ? null : delegate.getType();
  }

  public NVPair getResult() {
    if (delegate == null) {
      return null;
    } else {
      return delegate.getResult();
    }
  }

}
