/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * An attribute value as it comes back from storage: a type tag plus the stored bytes. Everything except
 * {@link ValueType#BYTE_ARRAY} is stored as UTF-8 text (numbers and dates in decimal, booleans as 0/1).
 * 
 * @see TypedValues#decode(String, RawValue)
 */
public final class RawValue {

  private final ValueType type;
  private final byte[]    data;

  public RawValue(ValueType type, byte[] data) {
    if (type == null) { throw new NullPointerException("type"); }
    this.type = type;
    this.data = data == null ? new byte[0] : data;
  }

  public static RawValue of(ValueType type, String storedText) {
    return new RawValue(type, storedText.getBytes(StandardCharsets.UTF_8));
  }

  public ValueType getType() {
    return type;
  }

  public byte[] getData() {
    return data;
  }

  String asText() {
    return new String(data, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "<" + getClass().getSimpleName() + ": type=" + type + " data="
           + (type == ValueType.BYTE_ARRAY ? Arrays.toString(data) : asText()) + ">";
  }

}
