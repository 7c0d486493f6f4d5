/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.groupby;

import com.terracottatech.graphquery.AbstractNVPair.UidNVPair;
import com.terracottatech.graphquery.Configuration;
import com.terracottatech.graphquery.Logger;
import com.terracottatech.graphquery.LoggerFactory;
import com.terracottatech.graphquery.NVPair;
import com.terracottatech.graphquery.TypedValues;
import com.terracottatech.graphquery.ValueType;
import com.terracottatech.graphquery.ValueTypeException;
import com.terracottatech.graphquery.uid.UidSet;
import com.terracottatech.graphquery.uid.UidSetBuilder;
import com.terracottatech.graphquery.uid.UidSets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per attribute index of the distinct values seen while grouping, each with the uids of the entities carrying it.
 * Buckets keep the order in which their attribute was first seen, and so do the values inside a bucket.
 */
public class DedupIndex {

  private final Logger             logger;
  private final Configuration      cfg;
  private final List<UniqueValues> buckets = new ArrayList<UniqueValues>();

  public DedupIndex(Configuration cfg, LoggerFactory loggerFactory) {
    this.cfg = cfg;
    this.logger = loggerFactory.getLogger(DedupIndex.class);
  }

  /**
   * Bucket of {@code attribute}, created at the end of the index if there is none yet.
   */
  public UniqueValues getGroup(String attribute) {
    // recently added buckets are the likely hits
    for (int i = buckets.size() - 1; i >= 0; i--) {
      UniqueValues bucket = buckets.get(i);
      if (bucket.getAttribute().equals(attribute)) { return bucket; }
    }

    UniqueValues bucket = new UniqueValues(attribute);
    buckets.add(bucket);
    return bucket;
  }

  /**
   * Record that entity {@code uid} has {@code value} for {@code attribute}. Values without a canonical string form
   * are dropped.
   */
  public void addValue(String attribute, NVPair value, long uid) {
    UniqueValues bucket = getGroup(attribute);

    final String key;
    if (value.getType() == ValueType.UID) {
      key = ((UidNVPair) value).getValue().toDecimalString();
    } else {
      try {
        key = TypedValues.marshal(value);
      } catch (ValueTypeException vte) {
        if (logger.isDebugEnabled()) {
          logger.debug("Dropping value of attribute [" + attribute + "] for uid " + Long.toUnsignedString(uid) + ": "
                       + vte.getMessage());
        }
        return;
      }
    }

    bucket.add(key, value, uid);
  }

  public List<UniqueValues> getBuckets() {
    return Collections.unmodifiableList(buckets);
  }

  public int size() {
    return buckets.size();
  }

  public boolean isEmpty() {
    return buckets.isEmpty();
  }

  @Override
  public String toString() {
    return "DedupIndex" + buckets;
  }

  /**
   * Distinct values of one attribute.
   */
  public final class UniqueValues {

    private final String                     attribute;
    private final Map<String, GroupElements> elements = new LinkedHashMap<String, GroupElements>();

    private UniqueValues(String attribute) {
      this.attribute = attribute;
    }

    public String getAttribute() {
      return attribute;
    }

    private void add(String key, NVPair value, long uid) {
      GroupElements element = elements.get(key);
      if (element == null) {
        // first value seen for the key represents it
        element = new GroupElements(value, UidSets.newBuilder(cfg));
        elements.put(key, element);
      }
      element.add(uid);
    }

    public List<GroupElements> getElements() {
      return new ArrayList<GroupElements>(elements.values());
    }

    public GroupElements getElement(String key) {
      return elements.get(key);
    }

    public int size() {
      return elements.size();
    }

    @Override
    public String toString() {
      return attribute + elements.keySet();
    }
  }

  /**
   * One distinct value and the entities that have it.
   */
  public static final class GroupElements {

    private final NVPair        key;
    private final UidSetBuilder builder;
    private UidSet              uids;

    private GroupElements(NVPair key, UidSetBuilder builder) {
      this.key = key;
      this.builder = builder;
    }

    private void add(long uid) {
      builder.add(uid);
      uids = null;
    }

    public NVPair getKey() {
      return key;
    }

    public UidSet getUids() {
      if (uids == null) {
        uids = builder.build();
      }
      return uids;
    }

    @Override
    public String toString() {
      return key + "->" + getUids();
    }
  }

}
