/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

/**
 * A named, typed value. Used for grouping keys, aggregate results and decoded attribute values.
 */
public interface NVPair {

  String getName();

  ValueType getType();

  Object getObjectValue();

  NVPair cloneWithNewName(String newName);

  NVPair cloneWithNewValue(Object newValue);

  String valueAsString();
}
