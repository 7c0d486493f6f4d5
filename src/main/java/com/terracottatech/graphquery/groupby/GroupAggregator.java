/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.groupby;

import com.terracottatech.graphquery.AggregatorOperations;
import com.terracottatech.graphquery.GroupResult;
import com.terracottatech.graphquery.InvalidQueryException;
import com.terracottatech.graphquery.Logger;
import com.terracottatech.graphquery.LoggerFactory;
import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.QueryException;
import com.terracottatech.graphquery.RawValue;
import com.terracottatech.graphquery.ResultNode;
import com.terracottatech.graphquery.Schema;
import com.terracottatech.graphquery.SourceFunction;
import com.terracottatech.graphquery.TypedValues;
import com.terracottatech.graphquery.ValueType;
import com.terracottatech.graphquery.ValueTypeException;
import com.terracottatech.graphquery.aggregator.AbstractAggregator;
import com.terracottatech.graphquery.aggregator.Aggregator;
import com.terracottatech.graphquery.aggregator.Count;

import java.util.List;

/**
 * Computes the aggregate a child field asks for over the entities of a group and appends it to the group.
 */
public class GroupAggregator {

  public static final String UID_ATTRIBUTE = "uid";

  private final Logger       logger;
  private final Schema       schema;

  public GroupAggregator(Schema schema, LoggerFactory loggerFactory) {
    this.schema = schema;
    this.logger = loggerFactory.getLogger(GroupAggregator.class);
  }

  /**
   * Append the aggregate of {@code child} to {@code group}. Children that are neither a count nor an aggregate
   * function contribute nothing, and neither does an aggregate over a group with no usable values.
   *
   * @throws InvalidQueryException if the child counts anything but uids
   * @throws QueryException if the aggregate function cannot be applied to the child's values
   */
  public void aggregateChild(GroupResult group, ResultNode child) throws QueryException {
    String alias = child.getParams().getAlias();

    if (child.getParams().isDoCount()) {
      if (!UID_ATTRIBUTE.equals(child.getAttribute())) {
        //
        throw new InvalidQueryException("Only uid predicate is allowed in count within groupby");
      }
      Count count = new Count(alias.length() > 0 ? alias : AggregatorOperations.COUNT.getFunctionName());
      count.increment(group.getUids().size());
      group.addAggregate(count.getResult());
      return;
    }

    SourceFunction fn = child.getSourceFunction();
    if (fn != null && AggregatorOperations.isAggregatorFunction(fn.getName())) {
      String name = alias.length() > 0 ? alias : fn.getName() + "(" + child.getAttribute() + ")";
      NVPair result = aggregateGroup(group, child, AggregatorOperations.forFunctionName(fn.getName()), name);
      if (result != null) {
        group.addAggregate(result);
      }
    }
  }

  /**
   * @return the aggregate named {@code name}, or null if no value of the group qualified
   */
  NVPair aggregateGroup(GroupResult group, ResultNode child, AggregatorOperations operation, String name)
      throws QueryException {
    ValueType declared = schema.getType(child.getAttribute());

    final Aggregator aggregator;
    try {
      aggregator = AbstractAggregator.aggregator(operation, name, declared);
    } catch (IllegalArgumentException iae) {
      throw new QueryException("Cannot apply " + operation.getFunctionName() + " to attribute ["
                               + child.getAttribute() + "]: " + iae.getMessage(), iae);
    }

    for (long uid : group.getUids().toArray()) {
      if (!child.getSrcUids().contains(uid)) {
        continue;
      }

      List<RawValue> values = child.getValues(uid);
      if (values.isEmpty()) {
        continue;
      }

      NVPair value;
      try {
        value = TypedValues.decode(child.getAttribute(), values.get(0));
        if (declared != null) {
          value = TypedValues.convert(value, declared);
        }
      } catch (ValueTypeException vte) {
        if (logger.isDebugEnabled()) {
          logger.debug("Skipping value of attribute [" + child.getAttribute() + "] for uid "
                       + Long.toUnsignedString(uid) + " in " + name + ": " + vte.getMessage());
        }
        continue;
      }

      try {
        aggregator.accept(value);
      } catch (IllegalArgumentException iae) {
        throw new QueryException("Cannot apply " + operation.getFunctionName() + " to attribute ["
                                 + child.getAttribute() + "]: " + iae.getMessage(), iae);
      }
    }

    return aggregator.getResult();
  }

}
