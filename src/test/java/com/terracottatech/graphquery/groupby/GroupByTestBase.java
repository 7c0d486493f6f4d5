/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.groupby;

import org.junit.Assert;
import org.junit.Before;

import com.terracottatech.graphquery.Configuration;
import com.terracottatech.graphquery.FieldParams;
import com.terracottatech.graphquery.GroupResult;
import com.terracottatech.graphquery.LoggerFactory;
import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.RawValue;
import com.terracottatech.graphquery.ResultNode;
import com.terracottatech.graphquery.Schema;
import com.terracottatech.graphquery.SourceFunction;
import com.terracottatech.graphquery.SysOutLoggerFactory;
import com.terracottatech.graphquery.ValueType;
import com.terracottatech.graphquery.VariableTable;
import com.terracottatech.graphquery.uid.UidList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class GroupByTestBase extends Assert {

  protected static final List<ResultNode> NO_PATH       = Collections.emptyList();

  protected final LoggerFactory           loggerFactory = new SysOutLoggerFactory(true);
  protected final Configuration           cfg           = getConfig();

  protected Schema                        schema;
  protected VariableTable                 vars;

  protected Configuration getConfig() {
    return new Configuration();
  }

  @Before
  public void setUp() throws Exception {
    schema = new Schema();
    vars = new VariableTable();
  }

  protected GroupByEvaluator newEvaluator() {
    return new GroupByEvaluator(schema, cfg, loggerFactory);
  }

  /**
   * Group-by node with one uid matrix row per argument.
   */
  protected static ResultNode groupByNode(long[]... rows) {
    ResultNode node = new ResultNode("me");
    long src = 1000;
    for (long[] row : rows) {
      node.setUidList(src++, UidList.of(row));
    }
    return node;
  }

  /**
   * Key child holding one stored value per uid. {@code uidValuePairs} alternates uid and stored text.
   */
  protected static ResultNode valueKey(String attribute, ValueType type, Object... uidValuePairs) {
    ResultNode child = new ResultNode(attribute, new FieldParams().groupKey());
    fillValues(child, type, uidValuePairs);
    return child;
  }

  /**
   * Key child following edges. {@code uidTargets} alternates a source uid and a {@code long[]} of adjacent uids.
   */
  protected static ResultNode uidKey(String attribute, Object... uidTargets) {
    ResultNode child = new ResultNode(attribute, new FieldParams().groupKey());
    List<Long> sources = new ArrayList<Long>();
    List<Long> targets = new ArrayList<Long>();
    for (int i = 0; i < uidTargets.length; i += 2) {
      long src = ((Number) uidTargets[i]).longValue();
      long[] adjacent = (long[]) uidTargets[i + 1];
      child.setUidList(src, UidList.of(adjacent));
      sources.add(src);
      for (long a : adjacent) {
        targets.add(a);
      }
    }
    child.setSrcUids(UidList.of(toArray(sources)));
    child.setDestUids(UidList.of(toArray(targets)));
    return child;
  }

  /**
   * Aggregate child computing {@code function} over stored values.
   */
  protected static ResultNode aggregate(String function, String attribute, FieldParams params, ValueType type,
                                        Object... uidValuePairs) {
    ResultNode child = new ResultNode(attribute, params);
    child.setSourceFunction(new SourceFunction(function));
    fillValues(child, type, uidValuePairs);
    return child;
  }

  protected static ResultNode aggregate(String function, String attribute, ValueType type, Object... uidValuePairs) {
    return aggregate(function, attribute, new FieldParams(), type, uidValuePairs);
  }

  protected static ResultNode count() {
    return new ResultNode("uid", new FieldParams().doCount());
  }

  private static void fillValues(ResultNode child, ValueType type, Object... uidValuePairs) {
    List<Long> sources = new ArrayList<Long>();
    for (int i = 0; i < uidValuePairs.length; i += 2) {
      long src = ((Number) uidValuePairs[i]).longValue();
      child.addValue(src, RawValue.of(type, String.valueOf(uidValuePairs[i + 1])));
      sources.add(src);
    }
    child.setSrcUids(UidList.of(toArray(sources)));
  }

  private static long[] toArray(List<Long> list) {
    long[] out = new long[list.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = list.get(i);
    }
    return out;
  }

  protected static List<Object> keyValues(GroupResult group) {
    List<Object> values = new ArrayList<Object>();
    for (NVPair key : group.getKeys()) {
      values.add(key.getObjectValue());
    }
    return values;
  }

  protected static NVPair aggregateNamed(GroupResult group, String name) {
    for (NVPair agg : group.getAggregates()) {
      if (agg.getName().equals(name)) { return agg; }
    }
    return null;
  }

}
