/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

import com.terracottatech.graphquery.uid.UidSet;
import com.terracottatech.graphquery.uid.UidSets;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A node of the query result tree. For every source uid it holds either the uids reached over the node's attribute
 * (uid matrix) or the stored values of the attribute (value matrix).
 * <p>
 * Nodes are not thread safe. A node is filled in by the query executor and afterwards handed to exactly one
 * evaluation step at a time.
 */
public class ResultNode {

  private final String                    attribute;
  private final FieldParams               params;
  private SourceFunction                  sourceFunction;

  private UidSet                          srcUids        = UidSets.empty();
  private UidSet                          destUids       = UidSets.empty();
  private final Map<Long, UidSet>         uidMatrix      = new LinkedHashMap<Long, UidSet>();
  private final Map<Long, List<RawValue>> valueMatrix    = new HashMap<Long, List<RawValue>>();

  private final List<ResultNode>          children       = new ArrayList<ResultNode>();
  private final List<GroupResults>        groupByResults = new ArrayList<GroupResults>();

  private final AtomicReference<Thread>   accessor       = new AtomicReference<Thread>();

  public ResultNode(String attribute) {
    this(attribute, new FieldParams());
  }

  public ResultNode(String attribute, FieldParams params) {
    this.attribute = attribute;
    this.params = params;
  }

  public String getAttribute() {
    return attribute;
  }

  public FieldParams getParams() {
    return params;
  }

  /**
   * Alias if the query gave one, else the attribute.
   */
  public String getFieldName() {
    return params.getAlias().length() > 0 ? params.getAlias() : attribute;
  }

  public SourceFunction getSourceFunction() {
    return sourceFunction;
  }

  public void setSourceFunction(SourceFunction sourceFunction) {
    this.sourceFunction = sourceFunction;
  }

  public UidSet getSrcUids() {
    return srcUids;
  }

  public void setSrcUids(UidSet srcUids) {
    this.srcUids = srcUids;
  }

  public UidSet getDestUids() {
    return destUids;
  }

  public void setDestUids(UidSet destUids) {
    this.destUids = destUids;
  }

  /**
   * A node with no destination uids holds values rather than edges.
   */
  public boolean isValueNode() {
    return destUids.isEmpty();
  }

  public void setUidList(long srcUid, UidSet adjacent) {
    uidMatrix.put(srcUid, adjacent);
  }

  public UidSet getUidList(long srcUid) {
    UidSet list = uidMatrix.get(srcUid);
    return list == null ? UidSets.empty() : list;
  }

  /**
   * Rows of the uid matrix in the order they were added.
   */
  public Collection<UidSet> getUidMatrix() {
    return Collections.unmodifiableCollection(uidMatrix.values());
  }

  public void addValue(long srcUid, RawValue value) {
    List<RawValue> values = valueMatrix.get(srcUid);
    if (values == null) {
      values = new ArrayList<RawValue>(1);
      valueMatrix.put(srcUid, values);
    }
    values.add(value);
  }

  public List<RawValue> getValues(long srcUid) {
    List<RawValue> values = valueMatrix.get(srcUid);
    if (values == null) { return Collections.emptyList(); }
    return Collections.unmodifiableList(values);
  }

  public ResultNode addChild(ResultNode child) {
    children.add(child);
    return this;
  }

  public List<ResultNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public void clearChildren() {
    children.clear();
  }

  public void addGroupByResults(GroupResults results) {
    groupByResults.add(results);
  }

  public List<GroupResults> getGroupByResults() {
    return Collections.unmodifiableList(groupByResults);
  }

  /**
   * Claim this node for the current thread.
   *
   * @throws AssertionError if another thread holds the node
   */
  public void acquire() {
    if (!accessor.compareAndSet(null, Thread.currentThread()) && accessor.get() != Thread.currentThread()) {
      //
      throw new AssertionError("Result node [" + attribute + "] is being accessed by a different thread");
    }
  }

  public void release() {
    accessor.compareAndSet(Thread.currentThread(), null);
  }

  @Override
  public String toString() {
    return "<" + getClass().getSimpleName() + ": attribute=" + attribute + " params=" + params + " function="
           + sourceFunction + " children=" + children.size() + ">";
  }

}
