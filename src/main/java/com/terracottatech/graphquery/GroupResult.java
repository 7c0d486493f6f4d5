/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

import com.terracottatech.graphquery.uid.UidSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One group produced by a group-by: the key values that define it, the aggregates computed over it and the uids of
 * the entities that fall into it.
 */
public class GroupResult {

  private final List<NVPair> keys;
  private final List<NVPair> aggregates = new ArrayList<NVPair>();
  private final UidSet       uids;

  public GroupResult(List<NVPair> keys, UidSet uids) {
    this.keys = Collections.unmodifiableList(new ArrayList<NVPair>(keys));
    this.uids = uids;
  }

  public List<NVPair> getKeys() {
    return keys;
  }

  public List<NVPair> getAggregates() {
    return Collections.unmodifiableList(aggregates);
  }

  public void addAggregate(NVPair aggregate) {
    aggregates.add(aggregate);
  }

  public UidSet getUids() {
    return uids;
  }

  /**
   * Keys followed by aggregates, in the order they are rendered for the group.
   */
  public List<NVPair> getAttributes() {
    List<NVPair> attributes = new ArrayList<NVPair>(keys.size() + aggregates.size());
    attributes.addAll(keys);
    attributes.addAll(aggregates);
    return attributes;
  }

  @Override
  public String toString() {
    return new StringBuilder(256).append("<").append(getClass().getSimpleName()).append(": keys=").append(keys)
        .append(" aggregates=").append(aggregates).append(" uids=").append(uids).append(">").toString();
  }

}
