/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Declared value type per attribute. Attributes without a declaration are left untyped and their values are used as
 * they were stored.
 */
public class Schema {

  private final ConcurrentMap<String, ValueType> types = new ConcurrentHashMap<String, ValueType>();

  public Schema() {
    //
  }

  public Schema(Map<String, ValueType> declared) {
    types.putAll(declared);
  }

  public ValueType getType(String attribute) {
    return types.get(attribute);
  }

  /**
   * @throws QueryException if {@code attribute} is already declared with a different type
   */
  public void declare(String attribute, ValueType type) throws QueryException {
    if (type == ValueType.NULL) { throw new QueryException("Attribute [" + attribute + "] cannot be declared as NULL"); }
    ValueType prev = types.putIfAbsent(attribute, type);
    if (prev != null && prev != type) {
      //
      throw new QueryException("Attribute type (" + type.name() + ") does not match schema type (" + prev.name()
                               + ") for attribute [" + attribute + "]");
    }
  }

  public Map<String, ValueType> asMap() {
    return Collections.unmodifiableMap(new HashMap<String, ValueType>(types));
  }

  /**
   * Read a schema stored as properties, one {@code attribute=TYPE} entry per attribute. The stream is not closed.
   */
  public static Schema load(InputStream in) throws QueryException {
    Properties data = new Properties();
    try {
      data.load(in);
    } catch (IOException ioe) {
      throw new QueryException(ioe);
    }

    Schema schema = new Schema();
    for (String attribute : data.stringPropertyNames()) {
      String typeName = data.getProperty(attribute).trim();
      final ValueType type;
      try {
        type = ValueType.valueOf(typeName);
      } catch (IllegalArgumentException iae) {
        throw new QueryException("Unknown type [" + typeName + "] for attribute [" + attribute + "]", iae);
      }
      schema.declare(attribute, type);
    }
    return schema;
  }

  public void store(OutputStream out) throws QueryException {
    Properties props = new Properties();

    for (Map.Entry<String, ValueType> entry : types.entrySet()) {
      props.setProperty(entry.getKey(), entry.getValue().name());
    }

    try {
      props.store(out, null);
    } catch (IOException e) {
      throw new QueryException(e);
    }
  }

  @Override
  public String toString() {
    return "Schema" + types;
  }

}
