/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

import java.io.Serializable;

/**
 * Entity identifier. The wrapped long is treated as an unsigned 64-bit quantity.
 */
public class Uid implements Serializable, Comparable<Uid> {

  private final long value;

  public Uid(long value) {
    this.value = value;
  }

  public static Uid parse(String text) throws NumberFormatException {
    if (text.startsWith("0x") || text.startsWith("0X")) { return new Uid(Long.parseUnsignedLong(text.substring(2), 16)); }
    return new Uid(Long.parseUnsignedLong(text));
  }

  @Override
  public String toString() {
    return "0x" + Long.toHexString(value);
  }

  public String toDecimalString() {
    return Long.toUnsignedString(value);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + (int) (value ^ (value >>> 32));
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null) return false;
    if (getClass() != obj.getClass()) return false;
    Uid other = (Uid) obj;
    if (value != other.value) return false;
    return true;
  }

  public int compareTo(Uid other) {
    return Long.compareUnsigned(value, other.value);
  }

  public long toLong() {
    return value;
  }

}
