/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.uid;

public interface UidSetBuilder {

  UidSetBuilder add(long uid);

  boolean isEmpty();

  UidSet build();

}
