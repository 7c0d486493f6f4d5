/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ordered groups formed for one row of a group-by node.
 */
public class GroupResults {

  private final List<GroupResult> groups;

  public GroupResults(List<GroupResult> groups) {
    this.groups = Collections.unmodifiableList(new ArrayList<GroupResult>(groups));
  }

  public List<GroupResult> getGroups() {
    return groups;
  }

  public int size() {
    return groups.size();
  }

  public boolean isEmpty() {
    return groups.isEmpty();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + groups;
  }

}
