/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Query wide mapping of variable name to bound values. Shared by all parts of one query evaluation.
 */
public class VariableTable {

  private final Map<String, VariableValue> vars = new LinkedHashMap<String, VariableValue>();

  public synchronized void put(String name, VariableValue value) {
    vars.put(name, value);
  }

  public synchronized VariableValue get(String name) {
    return vars.get(name);
  }

  public synchronized boolean contains(String name) {
    return vars.containsKey(name);
  }

  public synchronized Set<String> getNames() {
    return Collections.unmodifiableSet(new LinkedHashSet<String>(vars.keySet()));
  }

}
