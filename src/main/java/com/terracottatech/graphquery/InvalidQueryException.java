/*
 * All content copyright Terracotta, Inc., unless otherwise indicated. All rights reserved.
 */
package com.terracottatech.graphquery;

/**
 * Raised when the query itself asks for something the evaluator cannot do, as opposed to a failure while reading
 * the data it was given.
 */
public class InvalidQueryException extends QueryException {

  public InvalidQueryException(String message) {
    super(message);
  }

}
