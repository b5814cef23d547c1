package io.intellixity.fetchgraph.sketch;

/** Stable diagnostic codes. Callers match on these, so they never change meaning. */
public final class DiagnosticCodes {
  private DiagnosticCodes() {}

  public static final String PARSE_ERROR = "DSL_PARSE_ERROR";
  public static final String UNKNOWN_KEY = "DSL_UNKNOWN_KEY";
  public static final String DUPLICATE_KEY = "DSL_DUPLICATE_KEY";
  public static final String MISSING_REQUIRED_KEY = "DSL_MISSING_REQUIRED_KEY";
  public static final String MISSING_WHERE = "DSL_MISSING_WHERE";
  public static final String BAD_WHERE_TYPE = "DSL_BAD_WHERE_TYPE";
  public static final String BAD_WHERE_GROUP_TYPE = "DSL_BAD_WHERE_GROUP_TYPE";
  public static final String EMPTY_WHERE_OBJECT = "DSL_EMPTY_WHERE_OBJECT";
  public static final String WHERE_UNKNOWN_KEY = "DSL_WHERE_UNKNOWN_KEY";
  public static final String BAD_CLAUSE = "DSL_BAD_CLAUSE";
  public static final String BAD_CLAUSE_ARITY = "DSL_BAD_CLAUSE_ARITY";
  public static final String BAD_CLAUSE_PATH = "DSL_BAD_CLAUSE_PATH";
  public static final String BAD_OPERATOR = "DSL_BAD_OPERATOR";
  public static final String OP_AUTOCORRECT = "DSL_OP_AUTOCORRECT";
  public static final String UNKNOWN_OP = "DSL_UNKNOWN_OP";
  public static final String INVALID_TAKE = "DSL_INVALID_TAKE";
  public static final String INVALID_SKIP = "DSL_INVALID_SKIP";
  public static final String BAD_CASE_FLAG = "DSL_BAD_CASE_FLAG";
  public static final String BAD_GET = "DSL_BAD_GET";
  public static final String BAD_WITH = "DSL_BAD_WITH";
  public static final String BIND_AMBIGUOUS_FIELD = "DSL_BIND_AMBIGUOUS_FIELD";
}
