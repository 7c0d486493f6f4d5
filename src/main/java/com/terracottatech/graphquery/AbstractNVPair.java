/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

import java.util.Arrays;
import java.util.Date;

public abstract class AbstractNVPair implements NVPair {

  private final String name;

  AbstractNVPair(String name) {
    if (name == null) { throw new NullPointerException("name"); }
    this.name = name;
  }

  public final String getName() {
    return name;
  }

  @Override
  public final String toString() {
    return getType() + "(" + getName() + "," + valueAsString() + ")";
  }

  @Override
  public final boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null) return false;
    if (getClass() != obj.getClass()) return false;
    AbstractNVPair other = (AbstractNVPair) obj;
    if (!name.equals(other.name)) return false;
    return basicEquals(other);
  }

  @Override
  public final int hashCode() {
    return name.hashCode() ^ valueHashCode();
  }

  abstract boolean basicEquals(AbstractNVPair other);

  abstract int valueHashCode();

  public NVPair cloneWithNewValue(Object newValue) {
    return createNVPair(getName(), newValue, getType());
  }

  public static NVPair createNVPair(String attributeName, Object value) {
    if (value == null) return new NullNVPair(attributeName);

    if (value instanceof Uid) {
      return new UidNVPair(attributeName, (Uid) value);
    } else if (value instanceof Boolean) {
      return new BooleanNVPair(attributeName, (Boolean) value);
    } else if (value instanceof Integer) {
      return new IntNVPair(attributeName, (Integer) value);
    } else if (value instanceof Long) {
      return new LongNVPair(attributeName, (Long) value);
    } else if (value instanceof Float) {
      return new FloatNVPair(attributeName, (Float) value);
    } else if (value instanceof Double) {
      return new DoubleNVPair(attributeName, (Double) value);
    } else if (value instanceof String) {
      return new StringNVPair(attributeName, (String) value);
    } else if (value instanceof Date) {
      return new DateNVPair(attributeName, (Date) value);
    } else if (value instanceof byte[]) { return new ByteArrayNVPair(attributeName, (byte[]) value); }

    throw new IllegalArgumentException("Unsupported type: " + value.getClass());
  }

  public static NVPair createNVPair(String attributeName, Object value, ValueType type) {
    if (type == ValueType.NULL) {
      if (value != null) { throw new IllegalArgumentException("non-null value for NULL pair: " + value); }
      return new NullNVPair(attributeName);
    }

    if (value == null) { throw new IllegalArgumentException("null value for " + type + " attribute [" + attributeName
                                                            + "]"); }

    NVPair pair = createNVPair(attributeName, value);
    if (pair.getType() != type) { throw new IllegalArgumentException("Value " + value + " of attribute ["
                                                                     + attributeName + "] is not of type " + type); }
    return pair;
  }

  public static class NullNVPair extends AbstractNVPair {

    public NullNVPair(String name) {
      super(name);
    }

    public ValueType getType() {
      return ValueType.NULL;
    }

    public Object getObjectValue() {
      return null;
    }

    public String valueAsString() {
      return "null";
    }

    public NVPair cloneWithNewName(String newName) {
      return new NullNVPair(newName);
    }

    @Override
    boolean basicEquals(AbstractNVPair other) {
      return true;
    }

    @Override
    int valueHashCode() {
      return 0;
    }
  }

  public static class UidNVPair extends AbstractNVPair {

    private final Uid value;

    public UidNVPair(String name, Uid value) {
      super(name);
      this.value = value;
    }

    public Uid getValue() {
      return value;
    }

    public ValueType getType() {
      return ValueType.UID;
    }

    public Object getObjectValue() {
      return value;
    }

    public String valueAsString() {
      return value.toString();
    }

    public NVPair cloneWithNewName(String newName) {
      return new UidNVPair(newName, value);
    }

    @Override
    boolean basicEquals(AbstractNVPair other) {
      return value.equals(((UidNVPair) other).value);
    }

    @Override
    int valueHashCode() {
      return value.hashCode();
    }
  }

  public static class BooleanNVPair extends AbstractNVPair {

    private final boolean value;

    public BooleanNVPair(String name, boolean value) {
      super(name);
      this.value = value;
    }

    public boolean getValue() {
      return value;
    }

    public ValueType getType() {
      return ValueType.BOOLEAN;
    }

    public Object getObjectValue() {
      return Boolean.valueOf(value);
    }

    public String valueAsString() {
      return String.valueOf(value);
    }

    public NVPair cloneWithNewName(String newName) {
      return new BooleanNVPair(newName, value);
    }

    @Override
    boolean basicEquals(AbstractNVPair other) {
      return value == ((BooleanNVPair) other).value;
    }

    @Override
    int valueHashCode() {
      return value ? 1231 : 1237;
    }
  }

  public static class IntNVPair extends AbstractNVPair {

    private final int value;

    public IntNVPair(String name, int value) {
      super(name);
      this.value = value;
    }

    public int getValue() {
      return value;
    }

    public ValueType getType() {
      return ValueType.INT;
    }

    public Object getObjectValue() {
      return Integer.valueOf(value);
    }

    public String valueAsString() {
      return String.valueOf(value);
    }

    public NVPair cloneWithNewName(String newName) {
      return new IntNVPair(newName, value);
    }

    @Override
    boolean basicEquals(AbstractNVPair other) {
      return value == ((IntNVPair) other).value;
    }

    @Override
    int valueHashCode() {
      return value;
    }
  }

  public static class LongNVPair extends AbstractNVPair {

    private final long value;

    public LongNVPair(String name, long value) {
      super(name);
      this.value = value;
    }

    public long getValue() {
      return value;
    }

    public ValueType getType() {
      return ValueType.LONG;
    }

    public Object getObjectValue() {
      return Long.valueOf(value);
    }

    public String valueAsString() {
      return String.valueOf(value);
    }

    public NVPair cloneWithNewName(String newName) {
      return new LongNVPair(newName, value);
    }

    @Override
    boolean basicEquals(AbstractNVPair other) {
      return value == ((LongNVPair) other).value;
    }

    @Override
    int valueHashCode() {
      return (int) (value ^ (value >>> 32));
    }
  }

  public static class FloatNVPair extends AbstractNVPair {

    private final float value;

    public FloatNVPair(String name, float value) {
      super(name);
      this.value = value;
    }

    public float getValue() {
      return value;
    }

    public ValueType getType() {
      return ValueType.FLOAT;
    }

    public Object getObjectValue() {
      return Float.valueOf(value);
    }

    public String valueAsString() {
      return String.valueOf(value);
    }

    public NVPair cloneWithNewName(String newName) {
      return new FloatNVPair(newName, value);
    }

    @Override
    boolean basicEquals(AbstractNVPair other) {
      return Float.floatToIntBits(value) == Float.floatToIntBits(((FloatNVPair) other).value);
    }

    @Override
    int valueHashCode() {
      return Float.floatToIntBits(value);
    }
  }

  public static class DoubleNVPair extends AbstractNVPair {

    private final double value;

    public DoubleNVPair(String name, double value) {
      super(name);
      this.value = value;
    }

    public double getValue() {
      return value;
    }

    public ValueType getType() {
      return ValueType.DOUBLE;
    }

    public Object getObjectValue() {
      return Double.valueOf(value);
    }

    public String valueAsString() {
      return String.valueOf(value);
    }

    public NVPair cloneWithNewName(String newName) {
      return new DoubleNVPair(newName, value);
    }

    @Override
    boolean basicEquals(AbstractNVPair other) {
      return Double.doubleToLongBits(value) == Double.doubleToLongBits(((DoubleNVPair) other).value);
    }

    @Override
    int valueHashCode() {
      long bits = Double.doubleToLongBits(value);
      return (int) (bits ^ (bits >>> 32));
    }
  }

  public static class StringNVPair extends AbstractNVPair {

    private final String value;

    public StringNVPair(String name, String value) {
      super(name);
      this.value = value;
    }

    public String getValue() {
      return value;
    }

    public ValueType getType() {
      return ValueType.STRING;
    }

    public Object getObjectValue() {
      return value;
    }

    public String valueAsString() {
      return value;
    }

    public NVPair cloneWithNewName(String newName) {
      return new StringNVPair(newName, value);
    }

    @Override
    boolean basicEquals(AbstractNVPair other) {
      return value.equals(((StringNVPair) other).value);
    }

    @Override
    int valueHashCode() {
      return value.hashCode();
    }
  }

  public static class DateNVPair extends AbstractNVPair {

    private final Date value;

    public DateNVPair(String name, Date value) {
      super(name);
      this.value = new Date(value.getTime());
    }

    public Date getValue() {
      return new Date(value.getTime());
    }

    public ValueType getType() {
      return ValueType.DATE;
    }

    public Object getObjectValue() {
      return getValue();
    }

    public String valueAsString() {
      return String.valueOf(value.getTime());
    }

    public NVPair cloneWithNewName(String newName) {
      return new DateNVPair(newName, value);
    }

    @Override
    boolean basicEquals(AbstractNVPair other) {
      return value.getTime() == ((DateNVPair) other).value.getTime();
    }

    @Override
    int valueHashCode() {
      return value.hashCode();
    }
  }

  public static class ByteArrayNVPair extends AbstractNVPair {

    private final byte[] value;

    public ByteArrayNVPair(String name, byte[] value) {
      super(name);
      this.value = value;
    }

    public byte[] getValue() {
      return value;
    }

    public ValueType getType() {
      return ValueType.BYTE_ARRAY;
    }

    public Object getObjectValue() {
      return value;
    }

    public String valueAsString() {
      return Arrays.toString(value);
    }

    public NVPair cloneWithNewName(String newName) {
      return new ByteArrayNVPair(newName, value);
    }

    @Override
    boolean basicEquals(AbstractNVPair other) {
      return Arrays.equals(value, ((ByteArrayNVPair) other).value);
    }

    @Override
    int valueHashCode() {
      return Arrays.hashCode(value);
    }
  }

}
