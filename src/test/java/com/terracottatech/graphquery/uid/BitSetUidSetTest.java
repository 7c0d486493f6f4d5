/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.uid;

import org.junit.Assert;
import org.junit.Test;

import com.terracottatech.graphquery.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class BitSetUidSetTest extends Assert {

  @Test
  public void testMembership() {
    BitSetUidSet set = BitSetUidSet.of(3, 70, 3, 1000);
    assertEquals(3, set.size());
    assertTrue(set.contains(70));
    assertFalse(set.contains(71));
    assertFalse(set.contains(-1L));
    assertArrayEquals(new long[] { 3, 70, 1000 }, set.toArray());
  }

  @Test
  public void testIterate() throws Exception {
    final List<Long> seen = new ArrayList<Long>();
    BitSetUidSet.of(64, 0, 65).iterate(new UidVisitor() {
      public void visit(long uid) {
        seen.add(uid);
      }
    });
    assertEquals(Arrays.asList(0L, 64L, 65L), seen);
  }

  @Test
  public void testIntersect() {
    UidSet both = BitSetUidSet.of(1, 2, 200).intersect(BitSetUidSet.of(2, 200, 300));
    assertArrayEquals(new long[] { 2, 200 }, both.toArray());
    assertEquals(2, both.size());

    UidSet none = BitSetUidSet.of(1).intersect(BitSetUidSet.of(2));
    assertTrue(none.isEmpty());
  }

  @Test
  public void testIntersectWithList() {
    UidSet mixed = BitSetUidSet.of(1, 2, 3, 4).intersect(UidList.of(2, 4));
    assertArrayEquals(new long[] { 2, 4 }, mixed.toArray());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnsignedHighUidRejected() {
    UidSets.newBuilder(new Configuration(true, false)).add(0x8000000000000000L);
  }

  @Test
  public void testUidBeyondWordIndexRejected() {
    UidSetBuilder builder = UidSets.newBuilder(new Configuration(true, false));
    builder.add(5);
    try {
      builder.add(1L << 40);
      fail();
    } catch (IllegalArgumentException iae) {
      assertTrue(iae.getMessage(), iae.getMessage().contains(Long.toString(1L << 40)));
    }
    try {
      builder.add(BitSetUidSet.MAX_UID + 1);
      fail();
    } catch (IllegalArgumentException iae) {
      // expected
    }
    assertArrayEquals(new long[] { 5 }, builder.build().toArray());
  }

  @Test
  public void testUidBeyondWordIndexNotContained() {
    BitSetUidSet set = BitSetUidSet.of(0, 5);
    assertFalse(set.contains(1L << 40));
    assertFalse(set.contains((1L << 40) + 5));
    assertFalse(set.contains(Long.MAX_VALUE));
    assertTrue(set.contains(0));
  }

  @Test
  public void testBuilderSnapshots() {
    UidSetBuilder builder = UidSets.newBuilder(new Configuration(true, false));
    builder.add(5);
    UidSet first = builder.build();
    builder.add(6);
    assertEquals(1, first.size());
    assertEquals(2, builder.build().size());
    assertEquals("[0x5]", first.toString());
  }

}
