package io.intellixity.fetchgraph.query;

import java.util.Locale;
import java.util.Optional;

/** Backend comparison operators accepted by both execution engines. */
public enum ComparisonOp {
  EQ("="),
  NE("!="),
  LT("<"),
  GT(">"),
  LE("<="),
  GE(">="),

  IN("in"),
  NOT_IN("not_in"),

  LIKE("like"),
  ILIKE("ilike"),
  NOT_LIKE("not_like"),
  NOT_ILIKE("not_ilike"),
  STARTS("starts"),
  ENDS("ends"),
  NOT_STARTS("not_starts"),
  NOT_ENDS("not_ends");

  private final String symbol;

  ComparisonOp(String symbol) {
    this.symbol = symbol;
  }

  /** Wire form used in selector JSON. */
  public String symbol() { return symbol; }

  public static Optional<ComparisonOp> fromSymbol(String raw) {
    if (raw == null) return Optional.empty();
    String s = raw.trim().toLowerCase(Locale.ROOT);
    for (ComparisonOp op : values()) {
      if (op.symbol.equals(s)) return Optional.of(op);
    }
    return Optional.empty();
  }

  public ComparisonOp inverse() {
    return switch (this) {
      case EQ -> NE;
      case NE -> EQ;
      case LT -> GE;
      case GE -> LT;
      case GT -> LE;
      case LE -> GT;
      case IN -> NOT_IN;
      case NOT_IN -> IN;
      case LIKE -> NOT_LIKE;
      case NOT_LIKE -> LIKE;
      case ILIKE -> NOT_ILIKE;
      case NOT_ILIKE -> ILIKE;
      case STARTS -> NOT_STARTS;
      case NOT_STARTS -> STARTS;
      case ENDS -> NOT_ENDS;
      case NOT_ENDS -> ENDS;
    };
  }

  /** {@code in}/{@code not_in} take a sequence operand. */
  public boolean isSetOp() {
    return this == IN || this == NOT_IN;
  }

  /** Substring/prefix/suffix matching operators; the operand is compared as text. */
  public boolean isTextMatch() {
    return switch (this) {
      case LIKE, ILIKE, NOT_LIKE, NOT_ILIKE, STARTS, ENDS, NOT_STARTS, NOT_ENDS -> true;
      default -> false;
    };
  }

  public boolean isNegatedTextMatch() {
    return this == NOT_LIKE || this == NOT_ILIKE || this == NOT_STARTS || this == NOT_ENDS;
  }

  /** ilike-family ignores the query's case-sensitivity flag. */
  public boolean alwaysCaseInsensitive() {
    return this == ILIKE || this == NOT_ILIKE;
  }

  @Override
  public String toString() { return symbol; }
}
