/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

public class ValueTypeException extends Exception {

  private final ValueType type;

  public ValueTypeException(ValueType type, String message) {
    super(message);
    this.type = type;
  }

  public ValueTypeException(ValueType type, String message, Throwable cause) {
    super(message, cause);
    this.type = type;
  }

  public ValueType getType() {
    return type;
  }

}
