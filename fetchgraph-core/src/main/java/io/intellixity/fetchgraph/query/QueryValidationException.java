package io.intellixity.fetchgraph.query;

/**
 * Raised when a query references unknown entities, relations or fields, or otherwise fails validation.
 * <p>
 * Binding, compile and operand-type failures all extend this type, so callers can surface every hard error
 * through one catch site while still matching on the specific subclass.
 */
public class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
