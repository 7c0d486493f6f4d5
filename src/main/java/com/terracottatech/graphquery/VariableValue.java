/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values bound to a query variable: one value per entity uid, plus the chain of result nodes that leads to those
 * entities.
 */
public class VariableValue {

  private final Map<Uid, NVPair>  values;
  private final List<ResultNode> path;

  public VariableValue(Map<Uid, NVPair> values, List<ResultNode> path) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<Uid, NVPair>(values));
    this.path = Collections.unmodifiableList(new ArrayList<ResultNode>(path));
  }

  public Map<Uid, NVPair> getValues() {
    return values;
  }

  public NVPair getValue(Uid uid) {
    return values.get(uid);
  }

  public List<ResultNode> getPath() {
    return path;
  }

  @Override
  public String toString() {
    return "VariableValue[values=" + values + ", path=" + path.size() + " nodes]";
  }

}
