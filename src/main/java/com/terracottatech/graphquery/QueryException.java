/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

public class QueryException extends Exception {

  public QueryException() {
    super();
  }

  public QueryException(Throwable cause) {
    super(cause);
  }

  public QueryException(String message) {
    super(message);
  }

  public QueryException(String message, Throwable cause) {
    super(message, cause);
  }

}
