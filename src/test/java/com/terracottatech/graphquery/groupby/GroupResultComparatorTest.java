/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.groupby;

import com.terracottatech.graphquery.AbstractNVPair;
import com.terracottatech.graphquery.AbstractNVPair.ByteArrayNVPair;
import com.terracottatech.graphquery.GroupResult;
import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.uid.UidList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

import junit.framework.TestCase;

public class GroupResultComparatorTest extends TestCase {

  private final GroupResultComparator comparator = new GroupResultComparator();

  private static GroupResult group(long[] uids, Object... keys) {
    List<NVPair> pairs = new ArrayList<NVPair>();
    for (int i = 0; i < keys.length; i++) {
      pairs.add(AbstractNVPair.createNVPair("k" + i, keys[i]));
    }
    return new GroupResult(pairs, UidList.of(uids));
  }

  public void testUidCountFirst() {
    GroupResult small = group(new long[] { 5 }, "z");
    GroupResult large = group(new long[] { 1, 2 }, "a");

    assertTrue(comparator.compare(small, large) < 0);
    assertTrue(comparator.compare(large, small) > 0);
  }

  public void testKeyCountThenAggregateCount() {
    GroupResult oneKey = group(new long[] { 1 }, "z");
    GroupResult twoKeys = group(new long[] { 1 }, "a", "a");
    assertTrue(comparator.compare(oneKey, twoKeys) < 0);

    GroupResult withAgg = group(new long[] { 1 }, "a");
    withAgg.addAggregate(AbstractNVPair.createNVPair("count", 1L));
    assertTrue(comparator.compare(oneKey, withAgg) < 0);
  }

  public void testKeysThenAggregates() {
    GroupResult a = group(new long[] { 1 }, "a", 2);
    GroupResult b = group(new long[] { 2 }, "a", 10);
    assertTrue(comparator.compare(a, b) < 0);
    assertTrue(comparator.compare(b, a) > 0);

    GroupResult c = group(new long[] { 3 }, "a", 2);
    c.addAggregate(AbstractNVPair.createNVPair("sum", 1.5d));
    GroupResult d = group(new long[] { 4 }, "a", 2);
    d.addAggregate(AbstractNVPair.createNVPair("sum", 0.5d));
    assertTrue(comparator.compare(d, c) < 0);

    GroupResult e = group(new long[] { 5 }, "a", 2);
    e.addAggregate(AbstractNVPair.createNVPair("sum", 0.5d));
    assertEquals(0, comparator.compare(d, e));
  }

  public void testIncomparablePositionTies() {
    // different types at the first position, decided by the second
    GroupResult a = group(new long[] { 1 }, "x", 2);
    GroupResult b = group(new long[] { 2 }, 7, 1);
    assertTrue(comparator.compare(b, a) < 0);
    assertTrue(comparator.compare(a, b) > 0);

    GroupResult c = group(new long[] { 1 }, true);
    GroupResult d = group(new long[] { 2 }, false);
    assertEquals(0, comparator.compare(c, d));

    List<NVPair> blobKey = new ArrayList<NVPair>();
    blobKey.add(new ByteArrayNVPair("k0", new byte[] { 1 }));
    GroupResult e = new GroupResult(blobKey, UidList.of(1));
    assertEquals(0, comparator.compare(e, group(new long[] { 2 }, "x")));
  }

  public void testStableSortKeepsTies() {
    GroupResult first = group(new long[] { 1 }, true);
    GroupResult second = group(new long[] { 2 }, false);
    List<GroupResult> groups = new ArrayList<GroupResult>(Arrays.asList(first, second));

    comparator.sort(groups);
    assertSame(first, groups.get(0));
    assertSame(second, groups.get(1));
  }

  public void testOrderIndependentOfInput() {
    List<GroupResult> groups = new ArrayList<GroupResult>();
    groups.add(group(new long[] { 1, 2, 3 }, "a"));
    groups.add(group(new long[] { 4 }, "c"));
    groups.add(group(new long[] { 5 }, "b"));
    groups.add(group(new long[] { 6, 7 }, "d"));
    groups.add(group(new long[] { 8, 9 }, "a"));

    List<GroupResult> expected = new ArrayList<GroupResult>(groups);
    comparator.sort(expected);

    Random rnd = new Random(17);
    for (int i = 0; i < 25; i++) {
      List<GroupResult> shuffled = new ArrayList<GroupResult>(groups);
      Collections.shuffle(shuffled, rnd);
      comparator.sort(shuffled);
      assertEquals(expected, shuffled);
    }

    assertEquals("b", expected.get(0).getKeys().get(0).getObjectValue());
    assertEquals("c", expected.get(1).getKeys().get(0).getObjectValue());
    assertEquals("a", expected.get(2).getKeys().get(0).getObjectValue());
    assertEquals("d", expected.get(3).getKeys().get(0).getObjectValue());
    assertEquals(3, expected.get(4).getUids().size());
  }

  public void testManyMixedTypeGroupsOrderIndependentOfInput() {
    // even ranks carry an INT first key, odd ranks a STRING; the second key always follows the rank
    List<GroupResult> groups = new ArrayList<GroupResult>();
    for (int rank = 0; rank < 100; rank++) {
      String padded = String.format("%04d", rank);
      Object first = rank % 2 == 0 ? (Object) Integer.valueOf(rank) : padded;
      groups.add(group(new long[] { rank + 1 }, first, padded));
    }

    Random rnd = new Random(31);
    for (int i = 0; i < 20; i++) {
      List<GroupResult> one = new ArrayList<GroupResult>(groups);
      Collections.shuffle(one, rnd);
      List<GroupResult> other = new ArrayList<GroupResult>(one);
      Collections.reverse(other);

      comparator.sort(one);
      comparator.sort(other);
      assertEquals(groups, one);
      assertEquals(one, other);
    }
  }

  public void testSortAcceptsIntransitiveOrder() {
    // (INT 1, "c") < (INT 2, "a") < (STRING "z", "b") < (INT 1, "c")
    GroupResult a = group(new long[] { 1 }, 1, "c");
    GroupResult b = group(new long[] { 2 }, "z", "b");
    GroupResult c = group(new long[] { 3 }, 2, "a");
    assertTrue(comparator.compare(a, c) < 0);
    assertTrue(comparator.compare(c, b) < 0);
    assertTrue(comparator.compare(b, a) < 0);

    Random rnd = new Random(5);
    List<GroupResult> groups = new ArrayList<GroupResult>();
    for (int i = 0; i < 500; i++) {
      Object first = rnd.nextBoolean() ? (Object) Integer.valueOf(rnd.nextInt(40)) : "s" + rnd.nextInt(40);
      groups.add(group(new long[] { i }, first, "u" + rnd.nextInt(1000000) + "-" + i));
    }

    List<GroupResult> sorted = new ArrayList<GroupResult>(groups);
    comparator.sort(sorted);
    assertEquals(groups.size(), sorted.size());
    assertEquals(new HashSet<GroupResult>(groups), new HashSet<GroupResult>(sorted));

    List<GroupResult> again = new ArrayList<GroupResult>(groups);
    comparator.sort(again);
    assertEquals(sorted, again);
  }

}
