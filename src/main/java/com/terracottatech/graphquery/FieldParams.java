/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

/**
 * Per-field query parameters of a {@link ResultNode}.
 */
public class FieldParams {

  private String  alias    = "";
  private String  var      = "";
  private boolean doCount  = false;
  private boolean groupKey = false;

  public FieldParams() {
    //
  }

  /**
   * Output name of the field. Empty if the query gives none.
   */
  public String getAlias() {
    return alias;
  }

  public FieldParams alias(String name) {
    this.alias = name == null ? "" : name;
    return this;
  }

  /**
   * Name of the query variable the field's values are bound to. Empty if none.
   */
  public String getVar() {
    return var;
  }

  public FieldParams var(String name) {
    this.var = name == null ? "" : name;
    return this;
  }

  public boolean hasVar() {
    return var.length() > 0;
  }

  public boolean isDoCount() {
    return doCount;
  }

  public FieldParams doCount() {
    this.doCount = true;
    return this;
  }

  /**
   * Whether the field only contributes to the group-by key of its parent and is not part of the output itself.
   */
  public boolean isGroupKey() {
    return groupKey;
  }

  public FieldParams groupKey() {
    this.groupKey = true;
    return this;
  }

  @Override
  public String toString() {
    return "FieldParams[alias=" + alias + ", var=" + var + ", doCount=" + doCount + ", groupKey=" + groupKey + "]";
  }

}
