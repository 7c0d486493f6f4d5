/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.aggregator;

import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.ValueType;

/**
 * Sum over an attribute with no declared type. The concrete sum is picked from the type of the first value seen.
 */
public class EmptySum extends Sum {

  private Sum delegate;

  public EmptySum(String attributeName) {
    super(attributeName, null);
  }

  public void accept(NVPair input) throws IllegalArgumentException {
    if (isAbsent(input)) { return; }

    if (delegate == null) {
      delegate = Sum.sum(getAttributeName(), input.getType());
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
