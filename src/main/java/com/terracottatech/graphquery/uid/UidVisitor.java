/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery.uid;

import com.terracottatech.graphquery.QueryException;

public interface UidVisitor {

  /**
   * Called once per uid, in ascending unsigned order. Throwing stops the iteration and propagates to the caller of
   * {@link UidSet#iterate(UidVisitor)}.
   */
  void visit(long uid) throws QueryException;

}
