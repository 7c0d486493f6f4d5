/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.groupby;

import com.terracottatech.graphquery.GroupResult;
import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.TypedValues;
import com.terracottatech.graphquery.ValueTypeException;

import java.util.Comparator;
import java.util.List;

/**
 * Orders groups by size first: uid count, then key count, then aggregate count. Groups of equal size are ordered by
 * their keys and then their aggregates, position by position. A position whose values cannot be compared ties.
 * <p>
 * Ties on incomparable positions make this order intransitive once keys of different types meet, so groups must be
 * ordered with {@link #sort(List)} rather than {@link java.util.Collections#sort(List, Comparator)}, which may reject
 * such an order.
 */
public class GroupResultComparator implements Comparator<GroupResult> {

  public int compare(GroupResult g1, GroupResult g2) {
    int res = compareSizes(g1.getUids().size(), g2.getUids().size());
    if (res != 0) return res;

    res = compareSizes(g1.getKeys().size(), g2.getKeys().size());
    if (res != 0) return res;

    res = compareSizes(g1.getAggregates().size(), g2.getAggregates().size());
    if (res != 0) return res;

    res = compareValues(g1.getKeys(), g2.getKeys());
    if (res != 0) return res;

    return compareValues(g1.getAggregates(), g2.getAggregates());
  }

  /**
   * Stable merge sort of {@code groups} in place. Never checks the order for consistency; equal groups keep their
   * relative order.
   */
  public void sort(List<GroupResult> groups) {
    GroupResult[] a = groups.toArray(new GroupResult[groups.size()]);
    mergeSort(a, new GroupResult[a.length], 0, a.length);
    for (int i = 0; i < a.length; i++) {
      groups.set(i, a[i]);
    }
  }

  private void mergeSort(GroupResult[] a, GroupResult[] tmp, int from, int to) {
    if (to - from < 2) return;

    int mid = (from + to) >>> 1;
    mergeSort(a, tmp, from, mid);
    mergeSort(a, tmp, mid, to);

    System.arraycopy(a, from, tmp, from, to - from);
    int i = from;
    int j = mid;
    int k = from;
    while (i < mid && j < to) {
      // the right run wins only when strictly less
      if (compare(tmp[j], tmp[i]) < 0) {
        a[k++] = tmp[j++];
      } else {
        a[k++] = tmp[i++];
      }
    }
    while (i < mid) {
      a[k++] = tmp[i++];
    }
    while (j < to) {
      a[k++] = tmp[j++];
    }
  }

  private static int compareSizes(int a, int b) {
    return a < b ? -1 : (a == b ? 0 : 1);
  }

  private static int compareValues(List<NVPair> l1, List<NVPair> l2) {
    for (int i = 0; i < l1.size(); i++) {
      NVPair a = l1.get(i);
      NVPair b = l2.get(i);
      try {
        if (TypedValues.less(a, b)) return -1;
        if (TypedValues.less(b, a)) return 1;
      } catch (ValueTypeException vte) {
        // incomparable, try the next position
        continue;
      }
    }
    return 0;
  }

}
