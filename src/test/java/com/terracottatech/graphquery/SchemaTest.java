/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

import org.junit.Assert;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

public class SchemaTest extends Assert {

  @Test
  public void testDeclare() throws Exception {
    Schema schema = new Schema();
    assertNull(schema.getType("age"));

    schema.declare("age", ValueType.INT);
    schema.declare("age", ValueType.INT);
    assertEquals(ValueType.INT, schema.getType("age"));

    try {
      schema.declare("age", ValueType.STRING);
      fail();
    } catch (QueryException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("age"));
    }
    assertEquals(ValueType.INT, schema.getType("age"));
  }

  @Test(expected = QueryException.class)
  public void testNullTypeRejected() throws Exception {
    new Schema().declare("x", ValueType.NULL);
  }

  @Test
  public void testStoreAndLoad() throws Exception {
    Schema schema = new Schema();
    schema.declare("age", ValueType.LONG);
    schema.declare("name", ValueType.STRING);

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    schema.store(out);

    Schema loaded = Schema.load(new ByteArrayInputStream(out.toByteArray()));
    assertEquals(schema.asMap(), loaded.asMap());
  }

  @Test
  public void testLoadUnknownType() throws Exception {
    byte[] data = "age=NUMBER\n".getBytes(StandardCharsets.ISO_8859_1);
    try {
      Schema.load(new ByteArrayInputStream(data));
      fail();
    } catch (QueryException e) {
      assertTrue(e.getCause() instanceof IllegalArgumentException);
    }
  }

  @Test
  public void testLoadTrimsType() throws Exception {
    byte[] data = "age = DOUBLE \n".getBytes(StandardCharsets.ISO_8859_1);
    assertEquals(ValueType.DOUBLE, Schema.load(new ByteArrayInputStream(data)).getType("age"));
  }

}
