/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

public class Configuration {

  public static final boolean DEFAULT_USE_BITSET_UIDS = false;

  private boolean             useBitSetUids           = DEFAULT_USE_BITSET_UIDS;
  private boolean             doAccessChecks          = true;

  public Configuration() {
    //
  }

  public Configuration(boolean useBitSetUids, boolean doAccessChecks) {
    this.useBitSetUids = useBitSetUids;
    this.doAccessChecks = doAccessChecks;
  }

  /**
   * Whether uid lists collected while grouping are backed by bit sets rather than sorted arrays. Bit sets intersect
   * faster but their footprint grows with the largest uid, not with the number of uids. They only hold uids up to
   * {@link com.terracottatech.graphquery.uid.BitSetUidSet#MAX_UID}.
   */
  public boolean useBitSetUids() {
    return useBitSetUids;
  }

  public void setUseBitSetUids(boolean useBitSetUids) {
    this.useBitSetUids = useBitSetUids;
  }

  public boolean doAccessChecks() {
    return this.doAccessChecks;
  }

  public void setDoAccessChecks(boolean doChecks) {
    this.doAccessChecks = doChecks;
  }

}
