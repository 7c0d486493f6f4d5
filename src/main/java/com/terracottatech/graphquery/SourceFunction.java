/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Function a field's values are produced by, e.g. {@code sum(val(age))}.
 */
public class SourceFunction {

  private final String       name;
  private final List<String> args;

  public SourceFunction(String name, String... args) {
    if (name == null) { throw new NullPointerException("name"); }
    this.name = name;
    List<String> list = new ArrayList<String>(args.length);
    Collections.addAll(list, args);
    this.args = Collections.unmodifiableList(list);
  }

  public String getName() {
    return name;
  }

  public List<String> getArgs() {
    return args;
  }

  @Override
  public String toString() {
    return name + args;
  }

}
