/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

public enum ValueType {
  UID,

  NULL,

  BOOLEAN,

  INT,

  LONG,

  FLOAT,

  DOUBLE,

  STRING,

  DATE,

  BYTE_ARRAY;

  public boolean isNumeric() {
    switch (this) {
      case INT:
      case LONG:
      case FLOAT:
      case DOUBLE:
        return true;
      default:
        return false;
    }
  }

  public boolean isIntegral() {
    return this == INT || this == LONG;
  }

}
