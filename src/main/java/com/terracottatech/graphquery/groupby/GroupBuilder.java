/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.groupby;

import com.terracottatech.graphquery.GroupResult;
import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.groupby.DedupIndex.GroupElements;
import com.terracottatech.graphquery.groupby.DedupIndex.UniqueValues;
import com.terracottatech.graphquery.uid.UidSet;
import com.terracottatech.graphquery.uid.UidSets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the non empty groups of the cross product of all buckets of a {@link DedupIndex}. A group holds one value
 * per bucket and the uids that carry all of them.
 */
public final class GroupBuilder {

  private GroupBuilder() {
    //
  }

  public static List<GroupResult> formGroups(DedupIndex index) {
    List<GroupResult> groups = new ArrayList<GroupResult>();
    formGroups(index.getBuckets(), UidSets.empty(), Collections.<NVPair> emptyList(), groups);
    return groups;
  }

  private static void formGroups(List<UniqueValues> buckets, UidSet current, List<NVPair> keys,
                                 List<GroupResult> out) {
    int depth = keys.size();
    if (buckets.isEmpty() || (depth != 0 && current.isEmpty())) { return; }

    if (depth == buckets.size()) {
      out.add(new GroupResult(keys, current));
      return;
    }

    UniqueValues bucket = buckets.get(depth);
    for (GroupElements element : bucket.getElements()) {
      UidSet next = depth == 0 ? element.getUids() : current.intersect(element.getUids());

      List<NVPair> nextKeys = new ArrayList<NVPair>(depth + 1);
      nextKeys.addAll(keys);
      nextKeys.add(keyOf(bucket, element));
      formGroups(buckets, next, nextKeys, out);
    }
  }

  private static NVPair keyOf(UniqueValues bucket, GroupElements element) {
    NVPair key = element.getKey();
    return key.getName().equals(bucket.getAttribute()) ? key : key.cloneWithNewName(bucket.getAttribute());
  }

}
