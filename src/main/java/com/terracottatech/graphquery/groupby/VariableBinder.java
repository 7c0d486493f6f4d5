/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.groupby;

import com.terracottatech.graphquery.AbstractNVPair.UidNVPair;
import com.terracottatech.graphquery.GroupResult;
import com.terracottatech.graphquery.InvalidQueryException;
import com.terracottatech.graphquery.Logger;
import com.terracottatech.graphquery.LoggerFactory;
import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.QueryException;
import com.terracottatech.graphquery.ResultNode;
import com.terracottatech.graphquery.Uid;
import com.terracottatech.graphquery.ValueType;
import com.terracottatech.graphquery.VariableTable;
import com.terracottatech.graphquery.VariableValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes per group aggregates as query variables. Groups must be keyed by a single uid attribute; the variable maps
 * each key uid to the group's aggregate.
 */
public class VariableBinder {

  private final Logger          logger;
  private final GroupAggregator aggregator;

  public VariableBinder(GroupAggregator aggregator, LoggerFactory loggerFactory) {
    this.aggregator = aggregator;
    this.logger = loggerFactory.getLogger(VariableBinder.class);
  }

  public static boolean anyChildHasVar(List<ResultNode> children) {
    for (ResultNode child : children) {
      if (child.getParams().hasVar()) { return true; }
    }
    return false;
  }

  /**
   * Aggregate every non key child over {@code groups} and bind the children that declare a variable.
   *
   * @param pathNode the uid key child the variable's uids were reached through, may be null
   */
  public void bind(List<ResultNode> children, List<GroupResult> groups, VariableTable vars, List<ResultNode> path,
                   ResultNode pathNode) throws QueryException {
    for (ResultNode child : children) {
      if (child.getParams().isGroupKey()) {
        continue;
      }

      for (GroupResult group : groups) {
        aggregator.aggregateChild(group, child);
      }

      if (!child.getParams().hasVar()) {
        continue;
      }

      Map<Uid, NVPair> values = new LinkedHashMap<Uid, NVPair>();
      for (GroupResult group : groups) {
        List<NVPair> keys = group.getKeys();
        if (keys.isEmpty()) {
          continue;
        }
        if (keys.size() > 1) {
          //
          throw new InvalidQueryException("Expected one UID for var in groupby but got: " + keys.size());
        }

        NVPair key = keys.get(0);
        if (key.getType() != ValueType.UID) {
          //
          throw new InvalidQueryException("Vars can be assigned only when grouped by UID attribute");
        }

        // a group whose values all failed conversion has no aggregate
        List<NVPair> aggregates = group.getAggregates();
        if (!aggregates.isEmpty()) {
          values.put(((UidNVPair) key).getValue(), aggregates.get(aggregates.size() - 1));
        }
      }

      List<ResultNode> varPath = new ArrayList<ResultNode>(path);
      if (pathNode != null) {
        varPath.add(pathNode);
      }

      if (logger.isDebugEnabled()) {
        logger.debug("Binding var [" + child.getParams().getVar() + "] to " + values.size() + " values");
      }
      vars.put(child.getParams().getVar(), new VariableValue(values, varPath));
    }
  }

}
