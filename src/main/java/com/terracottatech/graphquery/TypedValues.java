/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

import com.terracottatech.graphquery.AbstractNVPair.BooleanNVPair;
import com.terracottatech.graphquery.AbstractNVPair.ByteArrayNVPair;
import com.terracottatech.graphquery.AbstractNVPair.DateNVPair;
import com.terracottatech.graphquery.AbstractNVPair.DoubleNVPair;
import com.terracottatech.graphquery.AbstractNVPair.FloatNVPair;
import com.terracottatech.graphquery.AbstractNVPair.IntNVPair;
import com.terracottatech.graphquery.AbstractNVPair.LongNVPair;
import com.terracottatech.graphquery.AbstractNVPair.NullNVPair;
import com.terracottatech.graphquery.AbstractNVPair.StringNVPair;
import com.terracottatech.graphquery.AbstractNVPair.UidNVPair;

import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Decoding, canonical string form, ordering and coercion of typed values.
 * <p>
 * Every operation here may fail for a particular combination of types; failures are reported with a checked
 * {@link ValueTypeException} and it is up to the caller to decide whether that is fatal.
 */
public final class TypedValues {

  private TypedValues() {
    //
  }

  /**
   * Turn a stored value into a typed pair named {@code attributeName}.
   */
  public static NVPair decode(String attributeName, RawValue raw) throws ValueTypeException {
    ValueType type = raw.getType();
    if (type == ValueType.BYTE_ARRAY) { return new ByteArrayNVPair(attributeName, raw.getData().clone()); }
    if (type == ValueType.NULL) { return new NullNVPair(attributeName); }

    String text = raw.asText();
    try {
      switch (type) {
        case UID:
          return new UidNVPair(attributeName, Uid.parse(text));
        case BOOLEAN:
          return new BooleanNVPair(attributeName, Integer.parseInt(text) != 0);
        case INT:
          return new IntNVPair(attributeName, Integer.parseInt(text));
        case LONG:
          return new LongNVPair(attributeName, Long.parseLong(text));
        case FLOAT:
          return new FloatNVPair(attributeName, Float.parseFloat(text));
        case DOUBLE:
          return new DoubleNVPair(attributeName, Double.parseDouble(text));
        case STRING:
          return new StringNVPair(attributeName, text);
        case DATE:
          return new DateNVPair(attributeName, new Date(Long.parseLong(text)));
        case BYTE_ARRAY:
        case NULL:
          // handled above
          throw new AssertionError(type);
      }
    } catch (NumberFormatException nfe) {
      throw new ValueTypeException(type, "Malformed stored " + type + " value for attribute [" + attributeName
                                         + "]: " + text, nfe);
    }

    throw new AssertionError(type);
  }

  /**
   * Canonical string form of a value. Two values of one attribute are considered equal for grouping purposes iff
   * their canonical forms are equal.
   */
  public static String marshal(NVPair value) throws ValueTypeException {
    ValueType type = value.getType();
    switch (type) {
      case UID:
        return ((UidNVPair) value).getValue().toDecimalString();
      case BOOLEAN:
      case INT:
      case LONG:
      case FLOAT:
      case DOUBLE:
      case STRING:
      case DATE:
        return value.valueAsString();
      case NULL:
      case BYTE_ARRAY:
        throw new ValueTypeException(type, "Cannot marshal " + type + " value of attribute [" + value.getName()
                                           + "] to string");
    }

    throw new AssertionError(type);
  }

  /**
   * @return true if {@code a} orders strictly before {@code b}
   * @throws ValueTypeException if the two values are of different types or their type has no ordering
   */
  public static boolean less(NVPair a, NVPair b) throws ValueTypeException {
    ValueType type = a.getType();
    if (type != b.getType()) { throw new ValueTypeException(type, "Arguments of different type cannot be compared: "
                                                                  + a + ", " + b); }

    switch (type) {
      case UID:
        return ((UidNVPair) a).getValue().compareTo(((UidNVPair) b).getValue()) < 0;
      case INT:
        return ((IntNVPair) a).getValue() < ((IntNVPair) b).getValue();
      case LONG:
        return ((LongNVPair) a).getValue() < ((LongNVPair) b).getValue();
      case FLOAT:
        return Float.compare(((FloatNVPair) a).getValue(), ((FloatNVPair) b).getValue()) < 0;
      case DOUBLE:
        return Double.compare(((DoubleNVPair) a).getValue(), ((DoubleNVPair) b).getValue()) < 0;
      case STRING:
        return ((StringNVPair) a).getValue().compareTo(((StringNVPair) b).getValue()) < 0;
      case DATE:
        return ((DateNVPair) a).getValue().getTime() < ((DateNVPair) b).getValue().getTime();
      case NULL:
      case BOOLEAN:
      case BYTE_ARRAY:
        throw new ValueTypeException(type, "Compare not supported for type " + type);
    }

    throw new AssertionError(type);
  }

  /**
   * Best effort coercion of {@code value} to {@code target}. The result keeps the name of the input.
   */
  public static NVPair convert(NVPair value, ValueType target) throws ValueTypeException {
    ValueType source = value.getType();
    if (source == target) { return value; }

    String name = value.getName();
    switch (source) {
      case STRING:
        return fromString(name, ((StringNVPair) value).getValue(), target);
      case INT:
        return fromLong(name, ((IntNVPair) value).getValue(), source, target);
      case LONG:
        return fromLong(name, ((LongNVPair) value).getValue(), source, target);
      case FLOAT:
        return fromDouble(name, ((FloatNVPair) value).getValue(), source, target);
      case DOUBLE:
        return fromDouble(name, ((DoubleNVPair) value).getValue(), source, target);
      case BOOLEAN:
        if (target == ValueType.STRING) { return new StringNVPair(name, value.valueAsString()); }
        return fromLong(name, ((BooleanNVPair) value).getValue() ? 1 : 0, source, target);
      case DATE: {
        long millis = ((DateNVPair) value).getValue().getTime();
        if (target == ValueType.LONG) { return new LongNVPair(name, millis); }
        if (target == ValueType.STRING) { return new StringNVPair(name, String.valueOf(millis)); }
        break;
      }
      case UID: {
        Uid uid = ((UidNVPair) value).getValue();
        if (target == ValueType.LONG) { return new LongNVPair(name, uid.toLong()); }
        if (target == ValueType.STRING) { return new StringNVPair(name, uid.toDecimalString()); }
        break;
      }
      case BYTE_ARRAY:
        if (target == ValueType.STRING) { return new StringNVPair(name, new String(((ByteArrayNVPair) value)
            .getValue(), StandardCharsets.UTF_8)); }
        break;
      case NULL:
        break;
    }

    throw cannotConvert(name, source, target);
  }

  private static NVPair fromString(String name, String text, ValueType target) throws ValueTypeException {
    try {
      switch (target) {
        case UID:
          return new UidNVPair(name, Uid.parse(text.trim()));
        case BOOLEAN:
          if ("true".equalsIgnoreCase(text)) { return new BooleanNVPair(name, true); }
          if ("false".equalsIgnoreCase(text)) { return new BooleanNVPair(name, false); }
          throw cannotConvert(name, ValueType.STRING, target);
        case INT:
          return new IntNVPair(name, Integer.parseInt(text.trim()));
        case LONG:
          return new LongNVPair(name, Long.parseLong(text.trim()));
        case FLOAT:
          return new FloatNVPair(name, Float.parseFloat(text.trim()));
        case DOUBLE:
          return new DoubleNVPair(name, Double.parseDouble(text.trim()));
        case DATE:
          return new DateNVPair(name, new Date(Long.parseLong(text.trim())));
        case BYTE_ARRAY:
          return new ByteArrayNVPair(name, text.getBytes(StandardCharsets.UTF_8));
        case STRING:
        case NULL:
          break;
      }
    } catch (NumberFormatException nfe) {
      throw new ValueTypeException(target, "Cannot parse '" + text + "' of attribute [" + name + "] as " + target,
                                   nfe);
    }
    throw cannotConvert(name, ValueType.STRING, target);
  }

  private static NVPair fromLong(String name, long value, ValueType source, ValueType target)
      throws ValueTypeException {
    switch (target) {
      case INT:
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
          //
          throw new ValueTypeException(target, "Value " + value + " of attribute [" + name + "] overflows INT");
        }
        return new IntNVPair(name, (int) value);
      case LONG:
        return new LongNVPair(name, value);
      case FLOAT:
        return new FloatNVPair(name, value);
      case DOUBLE:
        return new DoubleNVPair(name, value);
      case BOOLEAN:
        return new BooleanNVPair(name, value != 0);
      case STRING:
        return new StringNVPair(name, String.valueOf(value));
      case DATE:
        if (source == ValueType.BOOLEAN) break;
        return new DateNVPair(name, new Date(value));
      case UID:
        if (source == ValueType.BOOLEAN || value < 0) break;
        return new UidNVPair(name, new Uid(value));
      case BYTE_ARRAY:
      case NULL:
        break;
    }
    throw cannotConvert(name, source, target);
  }

  private static NVPair fromDouble(String name, double value, ValueType source, ValueType target)
      throws ValueTypeException {
    switch (target) {
      case INT:
      case LONG:
        if (Double.isNaN(value) || Double.isInfinite(value)) {
          //
          throw new ValueTypeException(target, "Value " + value + " of attribute [" + name + "] has no integral form");
        }
        if (value < Long.MIN_VALUE || value > Long.MAX_VALUE) {
          //
          throw new ValueTypeException(target, "Value " + value + " of attribute [" + name + "] overflows " + target);
        }
        return fromLong(name, (long) value, source, target);
      case FLOAT:
        return new FloatNVPair(name, (float) value);
      case DOUBLE:
        return new DoubleNVPair(name, value);
      case BOOLEAN:
        return new BooleanNVPair(name, value != 0);
      case STRING:
        return new StringNVPair(name, source == ValueType.FLOAT ? String.valueOf((float) value) : String
            .valueOf(value));
      case UID:
      case DATE:
      case BYTE_ARRAY:
      case NULL:
        break;
    }
    throw cannotConvert(name, source, target);
  }

  private static ValueTypeException cannotConvert(String name, ValueType source, ValueType target) {
    return new ValueTypeException(source, "Cannot convert " + source + " value of attribute [" + name + "] to "
                                          + target);
  }

}
