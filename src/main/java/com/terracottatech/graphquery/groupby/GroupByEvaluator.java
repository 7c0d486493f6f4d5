/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.groupby;

import com.terracottatech.graphquery.AbstractNVPair.UidNVPair;
import com.terracottatech.graphquery.Configuration;
import com.terracottatech.graphquery.GroupResult;
import com.terracottatech.graphquery.GroupResults;
import com.terracottatech.graphquery.Logger;
import com.terracottatech.graphquery.LoggerFactory;
import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.QueryException;
import com.terracottatech.graphquery.RawValue;
import com.terracottatech.graphquery.ResultNode;
import com.terracottatech.graphquery.Schema;
import com.terracottatech.graphquery.TypedValues;
import com.terracottatech.graphquery.Uid;
import com.terracottatech.graphquery.ValueTypeException;
import com.terracottatech.graphquery.VariableTable;
import com.terracottatech.graphquery.uid.UidSet;
import com.terracottatech.graphquery.uid.UidVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates the group-by of a result node.
 * <p>
 * Children flagged as group keys partition the entities of each row of the node's uid matrix; every other child may
 * contribute an aggregate per group. The groups of each row are appended to the node as one {@link GroupResults}.
 * Aggregates of children declaring a variable are then bound over the whole, unfiltered result, and finally the
 * node's children are dropped since the groups replace them.
 */
public class GroupByEvaluator {

  private final Logger                logger;
  private final Configuration         cfg;
  private final LoggerFactory         loggerFactory;
  private final GroupAggregator       aggregator;
  private final VariableBinder        binder;
  private final GroupResultComparator comparator = new GroupResultComparator();

  public GroupByEvaluator(Schema schema, Configuration cfg, LoggerFactory loggerFactory) {
    this.cfg = cfg;
    this.loggerFactory = loggerFactory;
    this.logger = loggerFactory.getLogger(GroupByEvaluator.class);
    this.aggregator = new GroupAggregator(schema, loggerFactory);
    this.binder = new VariableBinder(aggregator, loggerFactory);
  }

  /**
   * @param vars variables computed so far, receives the variables declared under {@code node}
   * @param path ancestors of {@code node}, root first
   * @throws QueryException if grouping or aggregation fails; nothing is appended to {@code node} then
   */
  public void evaluateGroupBy(ResultNode node, VariableTable vars, List<ResultNode> path) throws QueryException {
    if (cfg.doAccessChecks()) {
      node.acquire();
    }
    try {
      List<GroupResults> rows = new ArrayList<GroupResults>();
      for (UidSet row : node.getUidMatrix()) {
        rows.add(formResult(node, row));
      }

      fillGroupedVars(node, vars, path);

      for (GroupResults results : rows) {
        node.addGroupByResults(results);
      }
      node.clearChildren();

      if (logger.isDebugEnabled()) {
        logger.debug("Grouped " + rows.size() + " rows of [" + node.getAttribute() + "]");
      }
    } finally {
      if (cfg.doAccessChecks()) {
        node.release();
      }
    }
  }

  GroupResults formResult(ResultNode node, UidSet row) throws QueryException {
    DedupIndex index = new DedupIndex(cfg, loggerFactory);
    indexKeys(node, row, index);

    List<GroupResult> groups = GroupBuilder.formGroups(index);
    for (ResultNode child : node.getChildren()) {
      if (child.getParams().isGroupKey()) {
        continue;
      }
      for (GroupResult group : groups) {
        aggregator.aggregateChild(group, child);
      }
    }

    comparator.sort(groups);
    return new GroupResults(groups);
  }

  void fillGroupedVars(ResultNode node, VariableTable vars, List<ResultNode> path) throws QueryException {
    if (!VariableBinder.anyChildHasVar(node.getChildren())) { return; }

    DedupIndex index = new DedupIndex(cfg, loggerFactory);
    ResultNode pathNode = indexKeys(node, null, index);
    binder.bind(node.getChildren(), GroupBuilder.formGroups(index), vars, path, pathNode);
  }

  /**
   * Add the values of all key children of {@code node} to {@code index}.
   *
   * @param scope entities to consider, or null for all source entities of each child
   * @return the last key child holding uids, or null if there is none
   */
  private ResultNode indexKeys(ResultNode node, UidSet scope, final DedupIndex index) throws QueryException {
    ResultNode pathNode = null;

    for (final ResultNode child : node.getChildren()) {
      if (!child.getParams().isGroupKey()) {
        continue;
      }

      final String attribute = child.getFieldName();
      UidSet sources = scope == null ? child.getSrcUids() : child.getSrcUids().intersect(scope);

      if (child.isValueNode()) {
        sources.iterate(new UidVisitor() {
          public void visit(long srcUid) throws QueryException {
            List<RawValue> values = child.getValues(srcUid);
            if (values.isEmpty()) { return; }

            final NVPair value;
            try {
              value = TypedValues.decode(attribute, values.get(0));
            } catch (ValueTypeException vte) {
              throw new QueryException("Cannot group by attribute [" + attribute + "]", vte);
            }
            index.addValue(attribute, value, srcUid);
          }
        });
      } else {
        sources.iterate(new UidVisitor() {
          public void visit(final long srcUid) throws QueryException {
            child.getUidList(srcUid).iterate(new UidVisitor() {
              public void visit(long adjacent) {
                index.addValue(attribute, new UidNVPair(attribute, new Uid(adjacent)), srcUid);
              }
            });
          }
        });
        pathNode = child;
      }
    }

    return pathNode;
  }

}
