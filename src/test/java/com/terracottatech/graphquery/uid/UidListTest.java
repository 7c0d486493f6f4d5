/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.uid;

import com.terracottatech.graphquery.Configuration;
import com.terracottatech.graphquery.QueryException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import junit.framework.TestCase;

public class UidListTest extends TestCase {

  public void testSortedUnique() {
    UidList list = UidList.of(5, 1, 3, 1, 5);
    assertEquals(3, list.size());
    assertTrue(Arrays.equals(new long[] { 1, 3, 5 }, list.toArray()));
    assertTrue(list.contains(3));
    assertFalse(list.contains(4));
  }

  public void testUnsignedOrder() {
    long big = 0x8000000000000001L;
    UidList list = UidList.of(big, 2, -1L);
    assertTrue(Arrays.equals(new long[] { 2, big, -1L }, list.toArray()));
    assertTrue(list.contains(big));
    assertEquals("[0x2, 0x8000000000000001, 0xffffffffffffffff]", list.toString());
  }

  public void testIterateInOrder() throws Exception {
    final List<Long> seen = new ArrayList<Long>();
    UidList.of(9, 4, 7).iterate(new UidVisitor() {
      public void visit(long uid) {
        seen.add(uid);
      }
    });
    assertEquals(Arrays.asList(4L, 7L, 9L), seen);
  }

  public void testIterateStopsOnFailure() {
    final List<Long> seen = new ArrayList<Long>();
    try {
      UidList.of(1, 2, 3).iterate(new UidVisitor() {
        public void visit(long uid) throws QueryException {
          seen.add(uid);
          if (uid == 2) throw new QueryException("stop");
        }
      });
      fail();
    } catch (QueryException e) {
      assertEquals("stop", e.getMessage());
    }
    assertEquals(Arrays.asList(1L, 2L), seen);
  }

  public void testIntersect() {
    assertEquals(UidList.of(2, 4), UidList.of(1, 2, 3, 4).intersect(UidList.of(2, 4, 6)));
    assertTrue(UidList.of(1, 2).intersect(UidList.of(3)).isEmpty());
    assertTrue(UidList.of().intersect(UidList.of(3)).isEmpty());
  }

  public void testIntersectWithBitSet() {
    UidSet mixed = UidList.of(1, 5, 9).intersect(BitSetUidSet.of(5, 9, 12));
    assertTrue(mixed instanceof UidList);
    assertEquals(UidList.of(5, 9), mixed);
  }

  public void testBuilder() {
    UidSetBuilder builder = UidSets.newBuilder(new Configuration());
    assertTrue(builder.isEmpty());
    assertSame(UidSets.empty(), builder.build());

    builder.add(1).add(2).add(8);
    assertEquals(UidList.of(1, 2, 8), builder.build());

    builder.add(3).add(2);
    assertEquals(UidList.of(1, 2, 3, 8), builder.build());
  }

}
